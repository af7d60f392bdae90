package com.codeheadsystems.aegis.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window request counter.
 * <p>
 * The first request for a key opens a window of the given length. Up to {@code maxRequests}
 * requests are allowed in the window; later ones are denied until it ends. Check and increment
 * are one atomic step per key, so concurrent callers cannot exceed the limit.
 * <p>
 * Expired windows are replaced lazily on the next check and removed in bulk by
 * {@link #sweepExpired()}, which {@link ExpiredWindowSweeper} calls on a schedule.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final ConcurrentHashMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();
  private final Clock clock;

  public RateLimiter(Clock clock) {
    this.clock = clock;
  }

  public RateLimiter() {
    this(Clock.systemUTC());
  }

  /**
   * Counts a request against {@code key} and reports whether it is allowed.
   *
   * @param key         the counter key
   * @param windowMs    window length in milliseconds
   * @param maxRequests requests allowed per window
   * @return the decision
   */
  public RateLimitDecision check(String key, long windowMs, int maxRequests) {
    if (key == null || windowMs <= 0 || maxRequests < 1) {
      throw new IllegalArgumentException("key, positive windowMs and maxRequests >= 1 are required");
    }
    Instant now = clock.instant();
    AtomicReference<Boolean> allowed = new AtomicReference<>(Boolean.TRUE);
    RateLimitWindow window = windows.compute(key, (k, current) -> {
      if (current == null || current.isExpiredAt(now)) {
        return new RateLimitWindow(k, 1, now.plusMillis(windowMs));
      }
      if (current.requestCount() < maxRequests) {
        return current.increment();
      }
      allowed.set(Boolean.FALSE);
      return current;
    });
    int remaining = Math.max(0, maxRequests - window.requestCount());
    if (allowed.get()) {
      return new RateLimitDecision(true, maxRequests, remaining, window.resetAt(), 0);
    }
    long retryAfter = retryAfterSeconds(now, window.resetAt());
    log.warn("Rate limit exceeded: key={} limit={} retryAfter={}s", key, maxRequests, retryAfter);
    return new RateLimitDecision(false, maxRequests, 0, window.resetAt(), retryAfter);
  }

  /**
   * Checks a client against a named policy.
   */
  public RateLimitDecision check(RateLimitPolicy policy, ClientIdentity client) {
    return check(policy.keyFor(client.key()), policy.window().toMillis(), policy.maxRequests());
  }

  /**
   * Removes every window whose reset time has passed.
   *
   * @return the number of windows removed
   */
  public int sweepExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, RateLimitWindow> entry : windows.entrySet()) {
      // Conditional remove so a window reopened by a concurrent check survives.
      if (entry.getValue().isExpiredAt(now) && windows.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Swept {} expired rate limit window(s)", removed);
    }
    return removed;
  }

  /**
   * Number of windows currently tracked, expired or not.
   */
  public int size() {
    return windows.size();
  }

  static long retryAfterSeconds(Instant now, Instant resetAt) {
    long millis = Math.max(0, Duration.between(now, resetAt).toMillis());
    return (millis + 999) / 1000;
  }
}
