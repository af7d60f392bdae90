package com.codeheadsystems.aegis.crypto;

import com.codeheadsystems.aegis.exceptions.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A 32-byte key derived once per process from an operator passphrase.
 * <p>
 * Two independent instances exist in a running system: the secret plane (one-time-password
 * secrets) and the data plane (record fields, files, file access tokens). The key material is
 * never serialized and {@link #toString()} is redacted.
 */
public final class MasterKey {

  public static final int KEY_LENGTH = 32;
  public static final int MIN_PASSPHRASE_LENGTH = 32;

  private static final Logger log = LoggerFactory.getLogger(MasterKey.class);

  private final String plane;
  private final byte[] material;

  private MasterKey(String plane, byte[] material) {
    this.plane = plane;
    this.material = material;
  }

  /**
   * Derives a master key with PBKDF2 over the configured application salt.
   *
   * @param plane      a label used in logs and error messages, such as {@code "secret"}
   * @param passphrase the operator passphrase, at least {@value #MIN_PASSPHRASE_LENGTH} characters
   * @param config     the crypto configuration
   * @return the master key
   * @throws ConfigurationException if the passphrase is missing or too short
   */
  public static MasterKey derive(String plane, String passphrase, CryptoConfig config) {
    if (passphrase == null || passphrase.isBlank()) {
      throw new ConfigurationException("Master passphrase for the " + plane + " plane is not configured");
    }
    if (passphrase.length() < MIN_PASSPHRASE_LENGTH) {
      throw new ConfigurationException("Master passphrase for the " + plane
          + " plane must be at least " + MIN_PASSPHRASE_LENGTH + " characters");
    }
    if (config.masterIterations() < CryptoConfig.MIN_PRODUCTION_MASTER_ITERATIONS) {
      log.warn("Master key for the {} plane uses {} iterations. Do not use in production.",
          plane, config.masterIterations());
    }
    byte[] material = config.keyDerivation().derive(
        CryptoConfig.Pbkdf2Sha512.passphraseBytes(passphrase),
        config.applicationSalt(),
        config.masterIterations(),
        KEY_LENGTH);
    log.info("Derived master key for the {} plane", plane);
    return new MasterKey(plane, material);
  }

  public String plane() {
    return plane;
  }

  /**
   * Returns a copy of the key material. Callers should zero the copy when done.
   */
  public byte[] material() {
    return material.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }

  @Override
  public String toString() {
    return "MasterKey[plane=" + plane + ", material=<redacted>]";
  }
}
