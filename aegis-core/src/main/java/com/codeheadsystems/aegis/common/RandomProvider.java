package com.codeheadsystems.aegis.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for envelope salts and IVs, session tokens, one-time passcodes and backup codes.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Returns a single random unsigned byte value in {@code [0, 255]}.
   *
   * @return the unsigned byte
   */
  public int randomUnsignedByte() {
    return randomBytes(1)[0] & 0xFF;
  }
}
