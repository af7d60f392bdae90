package com.codeheadsystems.aegis.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The one place where internal failures are turned into client-facing errors.
 * <p>
 * Framework adapters (the JAX-RS exception mapper and the Spring controller advice) call
 * {@link #translate(Throwable)} and render the result. The full cause is logged here; the
 * returned {@link PublicError} never carries internal detail.
 * <ul>
 *   <li>{@link IllegalArgumentException} (including {@link ValidationException}) → 400 with a generic
 *       message; the detail is only logged</li>
 *   <li>{@link CryptoFailureException}, other {@link SecurityException} → 401</li>
 *   <li>{@link ThrottledException} → 429 with {@code retryAfter}</li>
 *   <li>{@link IllegalStateException} (including {@link ConfigurationException}) → 503</li>
 *   <li>anything else → 500</li>
 * </ul>
 */
public final class ErrorTranslator {

  public static final String INVALID_REQUEST = "Invalid request";
  public static final String AUTHENTICATION_FAILED = "Authentication failed";
  public static final String TOO_MANY_REQUESTS = "Too many requests";
  public static final String SERVICE_UNAVAILABLE = "Service unavailable";
  public static final String INTERNAL_ERROR = "Internal error";

  private static final Logger log = LoggerFactory.getLogger(ErrorTranslator.class);

  private ErrorTranslator() {
  }

  /**
   * Translates a failure into a sanitized error, logging the detail.
   *
   * @param failure the failure
   * @return the public error
   */
  public static PublicError translate(Throwable failure) {
    if (failure instanceof CryptoFailureException crypto) {
      log.warn("Crypto failure reason={} detail={}", crypto.reason(), crypto.detail(), crypto.getCause());
      return new PublicError(401, AUTHENTICATION_FAILED);
    }
    if (failure instanceof ThrottledException throttled) {
      log.warn("Throttled: {} retryAfter={}s", throttled.getMessage(), throttled.retryAfterSeconds());
      return new PublicError(429, throttled.getMessage(), throttled.retryAfterSeconds());
    }
    if (failure instanceof IllegalArgumentException) {
      log.debug("Rejected request: {}", failure.getMessage());
      return new PublicError(400, INVALID_REQUEST);
    }
    if (failure instanceof SecurityException) {
      log.debug("Authentication failure: {}", failure.getMessage());
      return new PublicError(401, AUTHENTICATION_FAILED);
    }
    if (failure instanceof IllegalStateException) {
      log.error("Service unavailable: {}", failure.getMessage(), failure);
      return new PublicError(503, SERVICE_UNAVAILABLE);
    }
    log.error("Unhandled failure", failure);
    return new PublicError(500, INTERNAL_ERROR);
  }
}
