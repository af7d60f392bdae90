package com.codeheadsystems.aegis.field;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.aegis.common.MutableClock;
import com.codeheadsystems.aegis.common.ObjectMappers;
import com.codeheadsystems.aegis.crypto.CryptoConfig;
import com.codeheadsystems.aegis.crypto.MasterKey;
import com.codeheadsystems.aegis.exceptions.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FileAccessTokenManagerTest {

  private static final String PASSPHRASE = "data-plane-passphrase-0123456789abcdef";

  private final ObjectMapper mapper = ObjectMappers.standard();
  private MutableClock clock;
  private MasterKey key;
  private FileAccessTokenManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    key = MasterKey.derive("data", PASSPHRASE, CryptoConfig.forTestingDataPlane());
    manager = new FileAccessTokenManager(key, mapper, clock, FileAccessTokenManager.DEFAULT_ISSUER);
  }

  @Test
  void generateAndVerify_grantsAccess() {
    String token = manager.generate("file-7", "subject-3", Duration.ofMinutes(10));

    assertThat(manager.verify(token)).hasValueSatisfying(access -> {
      assertThat(access.fileId()).isEqualTo("file-7");
      assertThat(access.subjectId()).isEqualTo("subject-3");
      assertThat(access.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
    });
  }

  @Test
  void token_carriesDocumentedFields() throws Exception {
    String token = manager.generate("file-7", "subject-3");

    ObjectNode json = (ObjectNode) mapper.readTree(Base64.getDecoder().decode(token));

    assertThat(json.fieldNames()).toIterable()
        .containsExactly("fileId", "subjectId", "exp", "iss", "signature");
    assertThat(json.get("iss").asText()).isEqualTo("aegis");
    assertThat(json.get("signature").asText()).matches("^[a-f0-9]{64}$");
  }

  @Test
  void verify_expired_isRejected() {
    String token = manager.generate("file-7", "subject-3", Duration.ofMinutes(10));
    clock.advance(Duration.ofMinutes(10));

    assertThat(manager.verify(token)).isEmpty();
  }

  @Test
  void verify_alteredClaims_isRejected() throws Exception {
    String token = manager.generate("file-7", "subject-3");
    ObjectNode json = (ObjectNode) mapper.readTree(Base64.getDecoder().decode(token));
    json.put("fileId", "file-8");
    String forged = Base64.getEncoder().encodeToString(mapper.writeValueAsBytes(json));

    assertThat(manager.verify(forged)).isEmpty();
  }

  @Test
  void verify_otherIssuer_isRejected() {
    FileAccessTokenManager other = new FileAccessTokenManager(key, mapper, clock, "someone-else");
    String token = other.generate("file-7", "subject-3");

    assertThat(manager.verify(token)).isEmpty();
  }

  @Test
  void verify_otherKey_isRejected() {
    MasterKey otherKey = MasterKey.derive("data", "a-different-passphrase-0123456789",
        CryptoConfig.forTestingDataPlane());
    FileAccessTokenManager other = new FileAccessTokenManager(otherKey, mapper, clock,
        FileAccessTokenManager.DEFAULT_ISSUER);

    assertThat(manager.verify(other.generate("file-7", "subject-3"))).isEmpty();
  }

  @Test
  void verify_garbage_isRejected() {
    assertThat(manager.verify("not-base64-!!")).isEmpty();
    assertThat(manager.verify(Base64.getEncoder().encodeToString("[]".getBytes()))).isEmpty();
    assertThat(manager.verify(null)).isEmpty();
  }

  @Test
  void verify_expiryBeyondInstantRange_isRejected() throws Exception {
    String token = manager.generate("file-7", "subject-3");
    ObjectNode json = (ObjectNode) mapper.readTree(Base64.getDecoder().decode(token));
    json.put("exp", Long.MAX_VALUE);
    String huge = Base64.getEncoder().encodeToString(mapper.writeValueAsBytes(json));
    json.put("exp", Long.MIN_VALUE);
    String tiny = Base64.getEncoder().encodeToString(mapper.writeValueAsBytes(json));

    assertThat(manager.verify(huge)).isEmpty();
    assertThat(manager.verify(tiny)).isEmpty();
  }

  @Test
  void generate_outOfRangeLifetime_isValidationError() {
    assertThatThrownBy(() -> manager.generate("file-7", "subject-3", Long.MAX_VALUE))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> manager.generate("file-7", "subject-3", Duration.ZERO))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> manager.generate("file-7", "subject-3", -5))
        .isInstanceOf(ValidationException.class);
  }
}
