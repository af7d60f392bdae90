package com.codeheadsystems.aegis.event;

import java.time.Duration;

/**
 * Limits and windows for {@link SecurityEventTracker}.
 *
 * @param maxEvents         events retained before the oldest is evicted
 * @param failureThreshold  failures from one address against one account that raise an alert
 * @param window            window for the failure and setup heuristics
 * @param setupAttemptLimit setup attempts per account allowed within the window
 * @param statsPeriod       period covered by the recent part of {@link SecurityStats}
 */
public record TrackerConfig(
    int maxEvents,
    int failureThreshold,
    Duration window,
    int setupAttemptLimit,
    Duration statsPeriod) {

  public static final TrackerConfig DEFAULT = new TrackerConfig(
      10_000, 5, Duration.ofMinutes(15), 3, Duration.ofHours(24));

  public TrackerConfig withMaxEvents(int maxEvents) {
    return new TrackerConfig(maxEvents, failureThreshold, window, setupAttemptLimit, statsPeriod);
  }
}
