package com.codeheadsystems.aegis.exceptions;

/**
 * Raised by orchestration code when an operation is refused because a rate limit or a setup
 * throttle is in effect. Maps to HTTP 429.
 */
public class ThrottledException extends RuntimeException {

  private final long retryAfterSeconds;

  public ThrottledException(String message, long retryAfterSeconds) {
    super(message);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long retryAfterSeconds() {
    return retryAfterSeconds;
  }
}
