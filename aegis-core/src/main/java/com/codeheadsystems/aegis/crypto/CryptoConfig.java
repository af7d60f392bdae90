package com.codeheadsystems.aegis.crypto;

import com.codeheadsystems.aegis.common.RandomProvider;
import com.codeheadsystems.aegis.exceptions.ConfigurationException;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Configuration for one {@link CryptoCore} instance.
 *
 * @param applicationSalt   fixed salt used to derive the {@link MasterKey} from its passphrase
 * @param masterIterations  PBKDF2 iterations for the master key
 * @param perCallIterations PBKDF2 iterations for each per-envelope key
 * @param maxPlaintextBytes largest plaintext accepted by {@link CryptoCore#encrypt(byte[])}
 * @param bcryptCost        bcrypt cost factor for backup code hashes
 * @param associatedData    default associated data bound into every envelope's tag
 * @param keyDerivation     the password-based key derivation function
 * @param randomProvider    source of salts, IVs, tokens and codes
 */
public record CryptoConfig(
    byte[] applicationSalt,
    int masterIterations,
    int perCallIterations,
    int maxPlaintextBytes,
    int bcryptCost,
    byte[] associatedData,
    KeyDerivation keyDerivation,
    RandomProvider randomProvider
) {

  public static final int MIN_PRODUCTION_MASTER_ITERATIONS = 100_000;
  public static final int DEFAULT_MAX_PLAINTEXT_BYTES = 10_000;
  public static final int MAX_FILE_BYTES = 10 * 1024 * 1024;

  private static final byte[] APPLICATION_SALT = "aegis-salt".getBytes(StandardCharsets.UTF_8);
  private static final byte[] SECRET_CONTEXT = "aegis-secret".getBytes(StandardCharsets.UTF_8);
  private static final byte[] DATA_CONTEXT = "aegis-data".getBytes(StandardCharsets.UTF_8);

  /**
   * Production configuration for the secret plane: one-time-password secrets and other
   * small authentication material.
   */
  public static final CryptoConfig DEFAULT = new CryptoConfig(
      APPLICATION_SALT,
      MIN_PRODUCTION_MASTER_ITERATIONS,
      10_000,
      DEFAULT_MAX_PLAINTEXT_BYTES,
      12,
      SECRET_CONTEXT,
      new Pbkdf2Sha512(),
      new RandomProvider()
  );

  /**
   * Production configuration for the data plane: record fields and uploaded files. The
   * plaintext bound is raised to the upload limit plus room for file metadata.
   */
  public static final CryptoConfig DATA_PLANE = new CryptoConfig(
      APPLICATION_SALT,
      MIN_PRODUCTION_MASTER_ITERATIONS,
      10_000,
      MAX_FILE_BYTES + DEFAULT_MAX_PLAINTEXT_BYTES,
      12,
      DATA_CONTEXT,
      new Pbkdf2Sha512(),
      new RandomProvider()
  );

  /**
   * Creates a secret-plane test configuration with cheap iteration counts and the minimum
   * bcrypt cost. Never use outside tests.
   */
  public static CryptoConfig forTesting() {
    return new CryptoConfig(APPLICATION_SALT, 1_000, 1_000, DEFAULT_MAX_PLAINTEXT_BYTES, 4,
        SECRET_CONTEXT, new Pbkdf2Sha512(), new RandomProvider());
  }

  /**
   * Creates a data-plane test configuration. Never use outside tests.
   */
  public static CryptoConfig forTestingDataPlane() {
    return forTesting().withMaxPlaintextBytes(MAX_FILE_BYTES + DEFAULT_MAX_PLAINTEXT_BYTES)
        .withAssociatedData(DATA_CONTEXT);
  }

  /**
   * Returns a new config identical to this one but with different iteration counts.
   */
  public CryptoConfig withIterations(int masterIterations, int perCallIterations) {
    return new CryptoConfig(applicationSalt, masterIterations, perCallIterations, maxPlaintextBytes,
        bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  /**
   * Returns a new config bound to a deployment-specific application salt. Changing the salt
   * changes the master keys, so every existing envelope becomes undecryptable.
   */
  public CryptoConfig withApplicationSalt(String applicationSalt) {
    if (applicationSalt == null || applicationSalt.isEmpty()) {
      throw new ConfigurationException("Application salt must not be empty");
    }
    return new CryptoConfig(applicationSalt.getBytes(StandardCharsets.UTF_8), masterIterations, perCallIterations,
        maxPlaintextBytes, bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  public CryptoConfig withMaxPlaintextBytes(int maxPlaintextBytes) {
    return new CryptoConfig(applicationSalt, masterIterations, perCallIterations, maxPlaintextBytes,
        bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  public CryptoConfig withBcryptCost(int bcryptCost) {
    return new CryptoConfig(applicationSalt, masterIterations, perCallIterations, maxPlaintextBytes,
        bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  public CryptoConfig withAssociatedData(byte[] associatedData) {
    return new CryptoConfig(applicationSalt, masterIterations, perCallIterations, maxPlaintextBytes,
        bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public CryptoConfig withRandomProvider(RandomProvider randomProvider) {
    return new CryptoConfig(applicationSalt, masterIterations, perCallIterations, maxPlaintextBytes,
        bcryptCost, associatedData, keyDerivation, randomProvider);
  }

  /**
   * Password-based key derivation function.
   */
  public interface KeyDerivation {
    byte[] derive(byte[] secret, byte[] salt, int iterations, int length);
  }

  /**
   * PBKDF2 with HMAC-SHA512.
   */
  public static class Pbkdf2Sha512 implements KeyDerivation {
    @Override
    public byte[] derive(byte[] secret, byte[] salt, int iterations, int length) {
      PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA512Digest());
      gen.init(secret, salt, iterations);
      KeyParameter key = (KeyParameter) gen.generateDerivedParameters(length * 8);
      return key.getKey();
    }

    /**
     * Encodes a passphrase the same way PBKDF2 implementations on other platforms do.
     */
    public static byte[] passphraseBytes(String passphrase) {
      return PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(passphrase.toCharArray());
    }
  }
}
