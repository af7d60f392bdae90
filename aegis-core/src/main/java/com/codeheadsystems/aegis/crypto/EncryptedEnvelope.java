package com.codeheadsystems.aegis.crypto;

import com.codeheadsystems.aegis.common.ByteUtils;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException.Reason;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * An authenticated-encryption envelope: {@code salt(32) || iv(16) || tag(16) || ciphertext},
 * carried as one base64 string. Immutable: every array is copied on the way in and out.
 *
 * @param salt       per-envelope key derivation salt
 * @param iv         GCM initialization vector
 * @param tag        GCM authentication tag
 * @param ciphertext the ciphertext, possibly empty
 */
public record EncryptedEnvelope(byte[] salt, byte[] iv, byte[] tag, byte[] ciphertext) {

  public static final int SALT_LENGTH = 32;
  public static final int IV_LENGTH = 16;
  public static final int TAG_LENGTH = 16;
  public static final int HEADER_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  public EncryptedEnvelope {
    salt = Objects.requireNonNull(salt, "salt").clone();
    iv = Objects.requireNonNull(iv, "iv").clone();
    tag = Objects.requireNonNull(tag, "tag").clone();
    ciphertext = Objects.requireNonNull(ciphertext, "ciphertext").clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  @Override
  public byte[] tag() {
    return tag.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  /**
   * Parses an encoded envelope. Only the layout is checked here; tag content is checked by
   * {@link CryptoCore#decrypt(EncryptedEnvelope, byte[])}.
   *
   * @param encoded base64 of the concatenated envelope
   * @return the envelope
   * @throws CryptoFailureException with reason {@link Reason#MALFORMED_INPUT} when the input is
   *                                not base64 or shorter than {@value #HEADER_LENGTH} bytes
   */
  public static EncryptedEnvelope decode(String encoded) {
    if (encoded == null || encoded.isEmpty()) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT, "Envelope is empty");
    }
    byte[] raw;
    try {
      raw = B64D.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT, "Envelope is not valid base64", e);
    }
    return fromBytes(raw);
  }

  /**
   * Splits raw envelope bytes into their parts.
   */
  public static EncryptedEnvelope fromBytes(byte[] raw) {
    if (raw.length < HEADER_LENGTH) {
      throw new CryptoFailureException(Reason.MALFORMED_INPUT,
          "Envelope is " + raw.length + " bytes, need at least " + HEADER_LENGTH);
    }
    return new EncryptedEnvelope(
        ByteUtils.slice(raw, 0, SALT_LENGTH),
        ByteUtils.slice(raw, SALT_LENGTH, IV_LENGTH),
        ByteUtils.slice(raw, SALT_LENGTH + IV_LENGTH, TAG_LENGTH),
        ByteUtils.slice(raw, HEADER_LENGTH, raw.length - HEADER_LENGTH));
  }

  public byte[] toBytes() {
    return ByteUtils.concat(salt, iv, tag, ciphertext);
  }

  public String encode() {
    return B64.encodeToString(toBytes());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptedEnvelope other
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(iv, other.iv)
        && Arrays.equals(tag, other.tag)
        && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(salt);
    result = 31 * result + Arrays.hashCode(iv);
    result = 31 * result + Arrays.hashCode(tag);
    return 31 * result + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "EncryptedEnvelope[ciphertextLength=" + ciphertext.length + "]";
  }
}
