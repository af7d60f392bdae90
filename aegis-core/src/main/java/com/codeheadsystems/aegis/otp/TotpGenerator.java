package com.codeheadsystems.aegis.otp;

import com.codeheadsystems.aegis.common.RandomProvider;
import com.codeheadsystems.aegis.validation.SecurityValidator;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.OptionalLong;
import org.apache.commons.codec.binary.Base32;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-based one-time passwords (RFC 6238): HMAC-SHA1, six digits, 30-second step, with a
 * tolerance of one step either side of the current one.
 * <p>
 * Secrets are 32 random bytes, base32 encoded without padding, which is the form authenticator
 * apps accept in a provisioning URI.
 */
public class TotpGenerator {

  public static final int SECRET_BYTES = 32;
  public static final int DIGITS = 6;
  public static final long STEP_SECONDS = 30;
  public static final int WINDOW = 1;
  public static final String DEFAULT_ISSUER = "Aegis";

  private static final Logger log = LoggerFactory.getLogger(TotpGenerator.class);
  private static final int MODULUS = 1_000_000;

  private final RandomProvider randomProvider;
  private final Clock clock;
  private final String issuer;
  private final Base32 base32 = new Base32();

  public TotpGenerator(RandomProvider randomProvider, Clock clock, String issuer) {
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.issuer = issuer;
  }

  public TotpGenerator() {
    this(new RandomProvider(), Clock.systemUTC(), DEFAULT_ISSUER);
  }

  /**
   * Generates a new shared secret.
   *
   * @return base32 secret without padding
   */
  public String generateSecret() {
    return base32.encodeToString(randomProvider.randomBytes(SECRET_BYTES)).replace("=", "");
  }

  /**
   * Computes the code for the step containing {@code instant}.
   */
  public String codeAt(String secret, Instant instant) {
    return codeForCounter(decode(secret), counterAt(instant));
  }

  /**
   * Checks a code against the current step and one step either side.
   *
   * @return the matching step counter, or empty if no step matches or the code is malformed
   */
  public OptionalLong matchCounter(String secret, String code) {
    if (!SecurityValidator.isValidTotpCode(code)) {
      return OptionalLong.empty();
    }
    byte[] key = decode(secret);
    byte[] supplied = code.getBytes(StandardCharsets.US_ASCII);
    long current = counterAt(clock.instant());
    long matched = -1;
    // No early exit: all candidates are compared.
    for (long counter = current - WINDOW; counter <= current + WINDOW; counter++) {
      byte[] candidate = codeForCounter(key, counter).getBytes(StandardCharsets.US_ASCII);
      if (Arrays.constantTimeAreEqual(candidate, supplied) && matched < 0) {
        matched = counter;
      }
    }
    log.debug("matchCounter(): matched={}", matched >= 0);
    return matched >= 0 ? OptionalLong.of(matched) : OptionalLong.empty();
  }

  public boolean verify(String secret, String code) {
    return matchCounter(secret, code).isPresent();
  }

  /**
   * Builds the {@code otpauth://} URI an authenticator app scans to enrol the secret.
   */
  public String provisioningUri(String accountName, String secret) {
    String encodedIssuer = urlEncode(issuer);
    return String.format(Locale.ROOT,
        "otpauth://totp/%s:%s?secret=%s&issuer=%s&algorithm=SHA1&digits=%d&period=%d",
        encodedIssuer, urlEncode(accountName), secret, encodedIssuer, DIGITS, STEP_SECONDS);
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private byte[] decode(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("TOTP secret is required");
    }
    return base32.decode(secret.toUpperCase(Locale.ROOT));
  }

  private static long counterAt(Instant instant) {
    return Math.floorDiv(instant.getEpochSecond(), STEP_SECONDS);
  }

  private static String codeForCounter(byte[] key, long counter) {
    HMac hmac = new HMac(new SHA1Digest());
    hmac.init(new KeyParameter(key));
    byte[] message = new byte[8];
    for (int i = 7; i >= 0; i--) {
      message[i] = (byte) (counter & 0xFF);
      counter >>= 8;
    }
    hmac.update(message, 0, message.length);
    byte[] hash = new byte[hmac.getMacSize()];
    hmac.doFinal(hash, 0);

    // Dynamic truncation, RFC 4226 section 5.3
    int offset = hash[hash.length - 1] & 0x0F;
    int binary = ((hash[offset] & 0x7F) << 24)
        | ((hash[offset + 1] & 0xFF) << 16)
        | ((hash[offset + 2] & 0xFF) << 8)
        | (hash[offset + 3] & 0xFF);
    return String.format(Locale.ROOT, "%0" + DIGITS + "d", binary % MODULUS);
  }
}
