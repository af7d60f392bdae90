package com.codeheadsystems.aegis.ratelimit;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that periodically removes expired {@link RateLimiter} windows.
 * <p>
 * Must be started explicitly and shut down on application stop. In Dropwizard it is registered
 * as a {@code Managed} component; in Spring Boot the bean declares
 * {@code initMethod = "start", destroyMethod = "shutdown"}.
 */
public class ExpiredWindowSweeper {

  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private static final Logger log = LoggerFactory.getLogger(ExpiredWindowSweeper.class);

  private final RateLimiter rateLimiter;
  private final Duration interval;
  private ScheduledExecutorService executor;
  private ScheduledFuture<?> task;

  public ExpiredWindowSweeper(RateLimiter rateLimiter, Duration interval) {
    this.rateLimiter = rateLimiter;
    this.interval = interval;
  }

  public ExpiredWindowSweeper(RateLimiter rateLimiter) {
    this(rateLimiter, DEFAULT_INTERVAL);
  }

  /**
   * Starts the sweep. Calling start on a running sweeper does nothing.
   */
  public synchronized void start() {
    if (isRunning()) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "rate-limit-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    task = executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Started rate limit sweeper, interval={}", interval);
  }

  /**
   * Cancels the sweep and releases the background thread.
   */
  public synchronized void shutdown() {
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
      log.info("Stopped rate limit sweeper");
    }
  }

  public synchronized boolean isRunning() {
    return task != null && !task.isCancelled();
  }

  private void sweep() {
    try {
      rateLimiter.sweepExpired();
    } catch (RuntimeException e) {
      // An exception escaping here would cancel the scheduled task.
      log.error("Rate limit sweep failed", e);
    }
  }
}
