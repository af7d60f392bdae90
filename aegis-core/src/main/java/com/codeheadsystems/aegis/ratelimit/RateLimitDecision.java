package com.codeheadsystems.aegis.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed           whether the request may proceed
 * @param limit             the maximum for the window
 * @param remaining         requests left in the window after this one
 * @param resetAt           when the window ends
 * @param retryAfterSeconds whole seconds until the window ends, rounded up; 0 when allowed
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt,
                                long retryAfterSeconds) {
}
