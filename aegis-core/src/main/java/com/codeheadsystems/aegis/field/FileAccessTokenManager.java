package com.codeheadsystems.aegis.field;

import com.codeheadsystems.aegis.crypto.MasterKey;
import com.codeheadsystems.aegis.exceptions.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies short-lived tokens that grant a subject access to one stored file.
 * <p>
 * A token is base64 of the JSON {@code {fileId, subjectId, exp, iss, signature}} where the
 * signature is HMAC-SHA256 over the JSON of the first four fields. The signing key is derived
 * from the data-plane {@link MasterKey}. Verification checks expiry first, then the signature,
 * then the issuer.
 */
public class FileAccessTokenManager {

  public static final String DEFAULT_ISSUER = "aegis";
  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  private static final Logger log = LoggerFactory.getLogger(FileAccessTokenManager.class);
  private static final byte[] SIGNING_LABEL = "aegis-file-token".getBytes(StandardCharsets.UTF_8);
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final byte[] signingKey;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String issuer;

  /**
   * Creates a new FileAccessTokenManager.
   *
   * @param dataPlaneKey the data-plane master key
   * @param objectMapper mapper for the token JSON
   * @param clock        time source for issue and expiry
   * @param issuer       value of the {@code iss} field
   */
  public FileAccessTokenManager(MasterKey dataPlaneKey, ObjectMapper objectMapper, Clock clock, String issuer) {
    byte[] master = dataPlaneKey.material();
    try {
      this.signingKey = hmac(master, SIGNING_LABEL);
    } finally {
      Arrays.fill(master, (byte) 0);
    }
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.issuer = issuer;
  }

  /**
   * Claims covered by the signature. Field order is fixed so the signed bytes are stable.
   */
  @JsonPropertyOrder({"fileId", "subjectId", "exp", "iss"})
  record Claims(
      @JsonProperty("fileId") String fileId,
      @JsonProperty("subjectId") String subjectId,
      @JsonProperty("exp") long exp,
      @JsonProperty("iss") String iss) {
  }

  @JsonPropertyOrder({"fileId", "subjectId", "exp", "iss", "signature"})
  record SignedToken(
      @JsonProperty("fileId") String fileId,
      @JsonProperty("subjectId") String subjectId,
      @JsonProperty("exp") long exp,
      @JsonProperty("iss") String iss,
      @JsonProperty("signature") String signature) {

    Claims claims() {
      return new Claims(fileId, subjectId, exp, iss);
    }
  }

  /**
   * Access granted by a verified token.
   *
   * @param fileId    the file
   * @param subjectId the subject allowed to read it
   * @param expiresAt when the grant lapses
   */
  public record FileAccess(String fileId, String subjectId, Instant expiresAt) {
  }

  public String generate(String fileId, String subjectId) {
    return generate(fileId, subjectId, DEFAULT_TTL);
  }

  public String generate(String fileId, String subjectId, long ttlSeconds) {
    return generate(fileId, subjectId, Duration.ofSeconds(ttlSeconds));
  }

  /**
   * Issues a token.
   *
   * @param fileId    the file
   * @param subjectId the subject
   * @param ttl       how long the token is valid, positive
   * @return the encoded token
   */
  public String generate(String fileId, String subjectId, Duration ttl) {
    if (fileId == null || subjectId == null) {
      throw new ValidationException("fileId and subjectId are required");
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new ValidationException("Token lifetime must be positive");
    }
    long exp;
    try {
      exp = clock.instant().plus(ttl).getEpochSecond();
    } catch (ArithmeticException | DateTimeException e) {
      throw new ValidationException("Token lifetime is out of range");
    }
    Claims claims = new Claims(fileId, subjectId, exp, issuer);
    try {
      String signature = sign(claims);
      SignedToken token = new SignedToken(fileId, subjectId, exp, issuer, signature);
      log.debug("Issued file token for fileId={} exp={}", fileId, exp);
      return B64.encodeToString(objectMapper.writeValueAsBytes(token));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize file token", e);
    }
  }

  /**
   * Verifies a token.
   *
   * @param token the encoded token
   * @return the access grant if valid, empty if malformed, expired, forged or from another issuer
   */
  public Optional<FileAccess> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    SignedToken decoded;
    try {
      decoded = objectMapper.readValue(B64D.decode(token), SignedToken.class);
    } catch (IllegalArgumentException | IOException e) {
      log.debug("File token is malformed: {}", e.getMessage());
      return Optional.empty();
    }
    // exp is compared as a number; it may lie outside the range Instant can hold.
    if (decoded.exp() <= clock.instant().getEpochSecond()) {
      log.debug("File token for fileId={} expired at {}", decoded.fileId(), decoded.exp());
      return Optional.empty();
    }
    if (decoded.exp() > Instant.MAX.getEpochSecond()) {
      log.debug("File token for fileId={} has an unrepresentable expiry", decoded.fileId());
      return Optional.empty();
    }
    Instant expiresAt = Instant.ofEpochSecond(decoded.exp());
    String expected;
    try {
      expected = sign(decoded.claims());
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (decoded.signature() == null || !org.bouncycastle.util.Arrays.constantTimeAreEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        decoded.signature().getBytes(StandardCharsets.US_ASCII))) {
      log.debug("File token signature mismatch for fileId={}", decoded.fileId());
      return Optional.empty();
    }
    if (!issuer.equals(decoded.iss())) {
      log.debug("File token issuer mismatch: {}", decoded.iss());
      return Optional.empty();
    }
    return Optional.of(new FileAccess(decoded.fileId(), decoded.subjectId(), expiresAt));
  }

  private String sign(Claims claims) throws JsonProcessingException {
    return Hex.toHexString(hmac(signingKey, objectMapper.writeValueAsBytes(claims)));
  }

  private static byte[] hmac(byte[] key, byte[] message) {
    HMac mac = new HMac(new SHA256Digest());
    mac.init(new KeyParameter(key));
    mac.update(message, 0, message.length);
    byte[] out = new byte[mac.getMacSize()];
    mac.doFinal(out, 0);
    return out;
  }
}
