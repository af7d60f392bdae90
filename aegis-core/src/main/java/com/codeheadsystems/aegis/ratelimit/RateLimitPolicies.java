package com.codeheadsystems.aegis.ratelimit;

import java.util.Locale;

/**
 * The policy set an HTTP adapter applies, and which request paths fall under which policy.
 * <ul>
 *   <li>{@code 2fa/setup}: authentication</li>
 *   <li>other {@code 2fa/*}: second factor</li>
 *   <li>{@code security/*}: admin</li>
 *   <li>everything else: general</li>
 * </ul>
 *
 * @param authentication enrolment and login attempts
 * @param secondFactor   one-time password and backup code submissions
 * @param admin          authenticated dashboard reads
 * @param general        all other paths
 */
public record RateLimitPolicies(RateLimitPolicy authentication,
                                RateLimitPolicy secondFactor,
                                RateLimitPolicy admin,
                                RateLimitPolicy general) {

  public static final RateLimitPolicies DEFAULT = new RateLimitPolicies(
      RateLimitPolicy.AUTHENTICATION, RateLimitPolicy.SECOND_FACTOR, RateLimitPolicy.ADMIN, RateLimitPolicy.GENERAL);

  /**
   * Picks the policy for a request path, with or without a leading slash.
   */
  public RateLimitPolicy forPath(String path) {
    String normalized = path == null ? "" : path.toLowerCase(Locale.ROOT);
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    if (normalized.equals("2fa/setup") || normalized.startsWith("2fa/setup/")) {
      return authentication;
    }
    if (normalized.startsWith("2fa/")) {
      return secondFactor;
    }
    if (normalized.equals("security") || normalized.startsWith("security/")) {
      return admin;
    }
    return general;
  }
}
