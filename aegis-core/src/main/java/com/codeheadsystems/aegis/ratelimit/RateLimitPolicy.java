package com.codeheadsystems.aegis.ratelimit;

import java.time.Duration;

/**
 * A named limit. Each policy counts in its own key space, so exhausting one does not affect
 * another for the same client.
 *
 * @param name        prefix for the counter key
 * @param window      window length
 * @param maxRequests requests allowed per window
 */
public record RateLimitPolicy(String name, Duration window, int maxRequests) {

  /** Password and login attempts. */
  public static final RateLimitPolicy AUTHENTICATION = new RateLimitPolicy("auth", Duration.ofMinutes(15), 5);
  /** One-time code and backup code attempts. */
  public static final RateLimitPolicy SECOND_FACTOR = new RateLimitPolicy("totp", Duration.ofMinutes(5), 3);
  /** Authenticated administrative operations. */
  public static final RateLimitPolicy ADMIN = new RateLimitPolicy("admin", Duration.ofMinutes(10), 100);
  /** Everything else. */
  public static final RateLimitPolicy GENERAL = new RateLimitPolicy("general", Duration.ofMinutes(1), 60);

  public RateLimitPolicy {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Policy name is required");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("Policy window must be positive");
    }
    if (maxRequests < 1) {
      throw new IllegalArgumentException("Policy maxRequests must be at least 1");
    }
  }

  String keyFor(String clientKey) {
    return name + "|" + clientKey;
  }
}
