package com.codeheadsystems.aegis.exceptions;

/**
 * Raised when an encryption or decryption operation fails.
 * <p>
 * {@link #getMessage()} is always one of two generic strings so that nothing about the failure
 * leaks to callers. The {@link Reason} and the optional detail are for server-side logging only.
 */
public class CryptoFailureException extends SecurityException {

  public static final String ENCRYPTION_FAILED_MESSAGE = "Encryption failed";
  public static final String DECRYPTION_FAILED_MESSAGE = "Decryption failed";

  /**
   * Why the operation failed.
   */
  public enum Reason {
    /** The cipher could not produce an envelope. */
    ENCRYPTION_FAILED,
    /** The envelope is truncated, badly encoded, or carries a zero or short tag. */
    MALFORMED_INPUT,
    /** The authentication tag did not verify; the envelope was tampered with or the key is wrong. */
    AUTHENTICATION_FAILED,
    /** Decryption succeeded but the plaintext could not be parsed. */
    CORRUPT_PAYLOAD,
    /** Decryption succeeded but the recomputed checksum does not match. */
    INTEGRITY_FAILED
  }

  private final Reason reason;
  private final String detail;

  public CryptoFailureException(Reason reason, String detail) {
    this(reason, detail, null);
  }

  public CryptoFailureException(Reason reason, String detail, Throwable cause) {
    super(reason == Reason.ENCRYPTION_FAILED ? ENCRYPTION_FAILED_MESSAGE : DECRYPTION_FAILED_MESSAGE,
        cause);
    this.reason = reason;
    this.detail = detail;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Internal diagnostic detail. Never return this to a client.
   */
  public String detail() {
    return detail;
  }
}
