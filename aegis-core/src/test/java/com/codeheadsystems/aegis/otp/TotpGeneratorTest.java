package com.codeheadsystems.aegis.otp;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.aegis.common.MutableClock;
import com.codeheadsystems.aegis.common.RandomProvider;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TotpGeneratorTest {

  // Base32 of the ASCII seed "12345678901234567890" from RFC 6238 appendix B.
  private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

  private MutableClock clock;
  private TotpGenerator generator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.ofEpochSecond(1_111_111_109L));
    generator = new TotpGenerator(new RandomProvider(), clock, "Aegis");
  }

  @Test
  void codeAt_matchesRfcVectors() {
    assertThat(generator.codeAt(RFC_SECRET, Instant.ofEpochSecond(59))).isEqualTo("287082");
    assertThat(generator.codeAt(RFC_SECRET, Instant.ofEpochSecond(1_111_111_109L))).isEqualTo("081804");
    assertThat(generator.codeAt(RFC_SECRET, Instant.ofEpochSecond(1_234_567_890L))).isEqualTo("005924");
  }

  @Test
  void codeAt_acceptsLowercaseSecret() {
    assertThat(generator.codeAt(RFC_SECRET.toLowerCase(), Instant.ofEpochSecond(59))).isEqualTo("287082");
  }

  @Test
  void verify_currentCode_succeeds() {
    String code = generator.codeAt(RFC_SECRET, clock.instant());

    assertThat(generator.verify(RFC_SECRET, code)).isTrue();
  }

  @Test
  void verify_oneStepEitherSide_succeeds() {
    String previous = generator.codeAt(RFC_SECRET, clock.instant().minusSeconds(30));
    String next = generator.codeAt(RFC_SECRET, clock.instant().plusSeconds(30));

    assertThat(generator.verify(RFC_SECRET, previous)).isTrue();
    assertThat(generator.verify(RFC_SECRET, next)).isTrue();
  }

  @Test
  void verify_twoStepsAway_fails() {
    String stale = generator.codeAt(RFC_SECRET, clock.instant());
    clock.advance(Duration.ofSeconds(90));

    assertThat(generator.verify(RFC_SECRET, stale)).isFalse();
  }

  @Test
  void matchCounter_reportsMatchedStep() {
    long current = clock.instant().getEpochSecond() / 30;
    String previous = generator.codeAt(RFC_SECRET, clock.instant().minusSeconds(30));

    assertThat(generator.matchCounter(RFC_SECRET, previous)).hasValue(current - 1);
  }

  @Test
  void verify_malformedCode_fails() {
    assertThat(generator.verify(RFC_SECRET, "12345")).isFalse();
    assertThat(generator.verify(RFC_SECRET, "abcdef")).isFalse();
    assertThat(generator.verify(RFC_SECRET, null)).isFalse();
  }

  @Test
  void generateSecret_isUnpaddedBase32Of32Bytes() {
    String secret = generator.generateSecret();

    assertThat(secret).matches("^[A-Z2-7]{52}$");
    assertThat(generator.generateSecret()).isNotEqualTo(secret);
  }

  @Test
  void generatedSecret_verifiesItsOwnCode() {
    String secret = generator.generateSecret();

    assertThat(generator.verify(secret, generator.codeAt(secret, clock.instant()))).isTrue();
  }

  @Test
  void provisioningUri_encodesIssuerAndAccount() {
    String uri = generator.provisioningUri("ops admin@example.com", RFC_SECRET);

    assertThat(uri).isEqualTo("otpauth://totp/Aegis:ops%20admin%40example.com?secret=" + RFC_SECRET
        + "&issuer=Aegis&algorithm=SHA1&digits=6&period=30");
  }
}
