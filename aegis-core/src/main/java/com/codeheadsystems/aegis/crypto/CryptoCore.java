package com.codeheadsystems.aegis.crypto;

import com.codeheadsystems.aegis.common.ByteUtils;
import com.codeheadsystems.aegis.common.RandomProvider;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException.Reason;
import com.codeheadsystems.aegis.exceptions.ValidationException;
import com.codeheadsystems.aegis.validation.SecurityValidator;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope encryption and secure random material bound to one {@link MasterKey}.
 * <p>
 * Every envelope gets a fresh salt and IV; the AES-256-GCM key for the envelope is derived from
 * the master key and that salt. Instances are stateless apart from their key and configuration
 * and are safe to share between threads.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link ValidationException}: plaintext too large or a malformed backup code</li>
 *   <li>{@link CryptoFailureException}: any cipher failure; the message is always generic</li>
 *   <li>{@link IllegalStateException}: the random source produced duplicate backup codes</li>
 * </ul>
 */
public class CryptoCore {

  private static final Logger log = LoggerFactory.getLogger(CryptoCore.class);

  private static final int TAG_BITS = EncryptedEnvelope.TAG_LENGTH * 8;
  private static final int SESSION_TOKEN_BYTES = 32;
  private static final int BACKUP_CODE_BYTES = 4;
  private static final int BSD_SALT_BYTES = 16;
  // Largest multiple of 10 not above 256; bytes at or above it would skew digit frequencies.
  private static final int OTP_REJECTION_BOUND = 250;

  private final MasterKey masterKey;
  private final CryptoConfig config;
  private final RandomProvider random;

  public CryptoCore(MasterKey masterKey, CryptoConfig config) {
    this.masterKey = masterKey;
    this.config = config;
    this.random = config.randomProvider();
    log.info("CryptoCore(plane={}, maxPlaintextBytes={})", masterKey.plane(), config.maxPlaintextBytes());
  }

  public CryptoConfig config() {
    return config;
  }

  @Override
  public String toString() {
    return "CryptoCore[plane=" + masterKey.plane() + "]";
  }

  // ─── Envelope encryption ──────────────────────────────────────────────────

  /**
   * Encrypts under the configured default associated data.
   */
  public EncryptedEnvelope encrypt(byte[] plaintext) {
    return encrypt(plaintext, config.associatedData());
  }

  /**
   * Encrypts {@code plaintext} into a new envelope.
   *
   * @param plaintext      at most {@link CryptoConfig#maxPlaintextBytes()} bytes
   * @param associatedData data bound into the tag; the same value must be given to decrypt
   * @return the envelope
   * @throws ValidationException    if the plaintext is missing or too large
   * @throws CryptoFailureException if the cipher fails
   */
  public EncryptedEnvelope encrypt(byte[] plaintext, byte[] associatedData) {
    if (plaintext == null) {
      throw new ValidationException("Plaintext is required");
    }
    if (plaintext.length > config.maxPlaintextBytes()) {
      throw new ValidationException("Plaintext exceeds " + config.maxPlaintextBytes() + " bytes");
    }
    byte[] salt = random.randomBytes(EncryptedEnvelope.SALT_LENGTH);
    byte[] iv = random.randomBytes(EncryptedEnvelope.IV_LENGTH);
    byte[] key = envelopeKey(salt);
    try {
      GCMModeCipher cipher = newCipher(true, key, iv, associatedData);
      byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
      int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
      len += cipher.doFinal(out, len);
      int ciphertextLength = len - EncryptedEnvelope.TAG_LENGTH;
      return new EncryptedEnvelope(salt, iv,
          ByteUtils.slice(out, ciphertextLength, EncryptedEnvelope.TAG_LENGTH),
          ByteUtils.slice(out, 0, ciphertextLength));
    } catch (InvalidCipherTextException | RuntimeException e) {
      throw new CryptoFailureException(Reason.ENCRYPTION_FAILED, e.getMessage(), e);
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  public String encryptToString(String plaintext) {
    return encrypt(plaintext.getBytes(StandardCharsets.UTF_8)).encode();
  }

  /**
   * Decrypts with the configured default associated data.
   */
  public byte[] decrypt(EncryptedEnvelope envelope) {
    return decrypt(envelope, config.associatedData());
  }

  /**
   * Verifies and decrypts an envelope.
   * <p>
   * The tag is checked for length and for being all zero before any key derivation or cipher
   * work is done.
   *
   * @throws CryptoFailureException with reason {@link Reason#MALFORMED_INPUT} for layout or tag
   *                                problems, {@link Reason#AUTHENTICATION_FAILED} when the tag
   *                                does not verify
   */
  public byte[] decrypt(EncryptedEnvelope envelope, byte[] associatedData) {
    if (envelope.salt().length != EncryptedEnvelope.SALT_LENGTH
        || envelope.iv().length != EncryptedEnvelope.IV_LENGTH) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT, "Invalid salt or IV length");
    }
    if (envelope.tag().length != EncryptedEnvelope.TAG_LENGTH) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT,
          "Invalid authentication tag length " + envelope.tag().length);
    }
    if (ByteUtils.isAllZero(envelope.tag())) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT, "All-zero authentication tag");
    }
    byte[] key = envelopeKey(envelope.salt());
    try {
      GCMModeCipher cipher = newCipher(false, key, envelope.iv(), associatedData);
      byte[] input = ByteUtils.concat(envelope.ciphertext(), envelope.tag());
      byte[] out = new byte[cipher.getOutputSize(input.length)];
      int len = cipher.processBytes(input, 0, input.length, out, 0);
      len += cipher.doFinal(out, len);
      return len == out.length ? out : Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException e) {
      throw new CryptoFailureException(Reason.AUTHENTICATION_FAILED, e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT, e.getMessage(), e);
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  public String decryptToString(String encodedEnvelope) {
    return new String(decrypt(EncryptedEnvelope.decode(encodedEnvelope)), StandardCharsets.UTF_8);
  }

  private byte[] envelopeKey(byte[] salt) {
    byte[] master = masterKey.material();
    try {
      return config.keyDerivation().derive(master, salt, config.perCallIterations(), MasterKey.KEY_LENGTH);
    } finally {
      Arrays.fill(master, (byte) 0);
    }
  }

  private static GCMModeCipher newCipher(boolean forEncryption, byte[] key, byte[] iv, byte[] associatedData) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_BITS, iv, associatedData));
    return cipher;
  }

  // ─── Random material ──────────────────────────────────────────────────────

  /**
   * Generates a session token: 32 random bytes as 64 lowercase hex characters.
   */
  public String generateSessionToken() {
    return Hex.toHexString(random.randomBytes(SESSION_TOKEN_BYTES));
  }

  /**
   * Generates a numeric one-time passcode with uniform digits. Random bytes of
   * {@value #OTP_REJECTION_BOUND} or more are discarded.
   *
   * @param length number of digits, at least 1
   * @return the passcode
   */
  public String generateOneTimePasscode(int length) {
    if (length < 1) {
      throw new ValidationException("Passcode length must be positive");
    }
    StringBuilder sb = new StringBuilder(length);
    while (sb.length() < length) {
      int value = random.randomUnsignedByte();
      if (value < OTP_REJECTION_BOUND) {
        sb.append((char) ('0' + value % 10));
      }
    }
    return sb.toString();
  }

  public String generateOneTimePasscode() {
    return generateOneTimePasscode(6);
  }

  /**
   * Generates recovery codes, each eight uppercase hex characters from four random bytes.
   *
   * @param count number of codes
   * @return the codes in generation order
   * @throws IllegalStateException if two generated codes collide
   */
  public List<String> generateBackupCodes(int count) {
    Set<String> codes = new LinkedHashSet<>();
    for (int i = 0; i < count; i++) {
      String code = Hex.toHexString(random.randomBytes(BACKUP_CODE_BYTES)).toUpperCase(Locale.ROOT);
      if (!codes.add(code)) {
        throw new IllegalStateException("Duplicate backup code generated");
      }
    }
    return List.copyOf(codes);
  }

  public List<String> generateBackupCodes() {
    return generateBackupCodes(8);
  }

  // ─── Backup code hashing ──────────────────────────────────────────────────

  /**
   * Hashes a backup code with bcrypt after normalizing it.
   *
   * @throws ValidationException if the code is malformed
   */
  public String hashBackupCode(String code) {
    String normalized = SecurityValidator.requireBackupCode(code);
    return OpenBSDBCrypt.generate(normalized.toCharArray(), random.randomBytes(BSD_SALT_BYTES),
        config.bcryptCost());
  }

  /**
   * Checks a code against a bcrypt hash. A malformed code is rejected without running bcrypt.
   *
   * @return true if the code matches
   */
  public boolean verifyBackupCode(String code, String hash) {
    Optional<String> normalized = SecurityValidator.normalizeBackupCode(code);
    if (normalized.isEmpty() || hash == null) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(hash, normalized.get().toCharArray());
    } catch (IllegalArgumentException e) {
      log.warn("Stored backup code hash is malformed: {}", e.getMessage());
      return false;
    }
  }
}
