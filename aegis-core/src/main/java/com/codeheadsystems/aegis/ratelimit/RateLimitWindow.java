package com.codeheadsystems.aegis.ratelimit;

import java.time.Instant;

/**
 * Counter state for one key within the current fixed window.
 *
 * @param key          the limited key
 * @param requestCount requests counted in this window
 * @param resetAt      when the window ends
 */
public record RateLimitWindow(String key, int requestCount, Instant resetAt) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(resetAt);
  }

  RateLimitWindow increment() {
    return new RateLimitWindow(key, requestCount + 1, resetAt);
  }
}
