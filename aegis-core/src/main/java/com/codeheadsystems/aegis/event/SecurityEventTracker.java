package com.codeheadsystems.aegis.event;

import com.codeheadsystems.aegis.ratelimit.ClientIdentity;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory log of second-factor events with a failure heuristic.
 * <p>
 * Events are kept in arrival order. Once {@link TrackerConfig#maxEvents()} is reached the oldest
 * event is evicted for each new one. After every append the tracker counts failures for the same
 * account and address within the window; at {@link TrackerConfig#failureThreshold()} or more it
 * notifies every {@link SecurityAlertListener} and returns the alert.
 * <p>
 * State is per process. Instances behind a load balancer do not share events.
 */
public class SecurityEventTracker {

  public static final int DEFAULT_EVENT_LIMIT = 50;
  public static final String SETUP_DENIED_REASON =
      "Too many two-factor setup attempts. Please wait before trying again.";

  private static final Logger log = LoggerFactory.getLogger(SecurityEventTracker.class);

  private final Deque<SecurityEvent> events = new ArrayDeque<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<SecurityAlertListener> listeners = new CopyOnWriteArrayList<>();
  private final TrackerConfig config;
  private final Clock clock;

  public SecurityEventTracker(TrackerConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
    log.info("SecurityEventTracker(maxEvents={}, failureThreshold={}, window={})",
        config.maxEvents(), config.failureThreshold(), config.window());
  }

  public SecurityEventTracker() {
    this(TrackerConfig.DEFAULT, Clock.systemUTC());
  }

  public void addListener(SecurityAlertListener listener) {
    listeners.add(listener);
  }

  /**
   * Records an event stamped with the current time.
   */
  public Optional<SecurityAlert> record(String adminId, ClientIdentity client, SecurityAction action,
                                        boolean success) {
    return record(new SecurityEvent(adminId, client.address(), client.signature(), action, success,
        clock.instant()));
  }

  /**
   * Appends an event and evaluates the failure heuristic for its account and address.
   *
   * @param event the event
   * @return the alert, if the threshold is reached
   */
  public Optional<SecurityAlert> record(SecurityEvent event) {
    int failures;
    lock.writeLock().lock();
    try {
      events.addLast(event);
      while (events.size() > config.maxEvents()) {
        events.removeFirst();
      }
      failures = countRecentFailures(event.adminId(), event.clientAddress());
    } finally {
      lock.writeLock().unlock();
    }
    log.debug("record(action={}, success={})", event.action(), event.success());
    if (failures < config.failureThreshold()) {
      return Optional.empty();
    }
    SecurityAlert alert = new SecurityAlert(event.adminId(), event.clientAddress(), failures,
        config.window(), clock.instant());
    for (SecurityAlertListener listener : listeners) {
      try {
        listener.onAlert(alert);
      } catch (RuntimeException e) {
        log.error("Security alert listener failed", e);
      }
    }
    return Optional.of(alert);
  }

  private int countRecentFailures(String adminId, String clientAddress) {
    Instant cutoff = clock.instant().minus(config.window());
    int count = 0;
    for (Iterator<SecurityEvent> it = events.descendingIterator(); it.hasNext(); ) {
      SecurityEvent e = it.next();
      if (!e.timestamp().isAfter(cutoff)) {
        continue;
      }
      if (!e.success() && e.adminId().equals(adminId) && e.clientAddress().equals(clientAddress)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns an account's events, most recent first.
   *
   * @param adminId the account
   * @param limit   maximum number of events
   */
  public List<SecurityEvent> getEventsFor(String adminId, int limit) {
    List<SecurityEvent> result = new ArrayList<>();
    lock.readLock().lock();
    try {
      for (Iterator<SecurityEvent> it = events.descendingIterator(); it.hasNext() && result.size() < limit; ) {
        SecurityEvent e = it.next();
        if (e.adminId().equals(adminId)) {
          result.add(e);
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    return result;
  }

  public List<SecurityEvent> getEventsFor(String adminId) {
    return getEventsFor(adminId, DEFAULT_EVENT_LIMIT);
  }

  /**
   * Summarizes the recent period and the whole retained log.
   */
  public SecurityStats getStats() {
    Instant cutoff = clock.instant().minus(config.statsPeriod());
    int total = 0;
    int succeeded = 0;
    Set<String> addresses = new HashSet<>();
    Set<String> admins = new HashSet<>();
    int retained;
    Instant oldest;
    lock.readLock().lock();
    try {
      retained = events.size();
      oldest = events.isEmpty() ? null : events.peekFirst().timestamp();
      for (SecurityEvent e : events) {
        if (!e.timestamp().isAfter(cutoff)) {
          continue;
        }
        total++;
        if (e.success()) {
          succeeded++;
        }
        addresses.add(e.clientAddress());
        admins.add(e.adminId());
      }
    } finally {
      lock.readLock().unlock();
    }
    double rate = total == 0 ? 0.0 : succeeded * 100.0 / total;
    return new SecurityStats(
        new SecurityStats.Recent(total, succeeded, total - succeeded, rate, addresses.size(), admins.size()),
        new SecurityStats.AllTime(retained, oldest));
  }

  /**
   * Decides whether an account may begin another setup. Denied once the account has
   * {@link TrackerConfig#setupAttemptLimit()} setup events within the window.
   */
  public SetupDecision validateSetupAttempt(String adminId, String clientAddress) {
    Instant cutoff = clock.instant().minus(config.window());
    int attempts = 0;
    lock.readLock().lock();
    try {
      for (Iterator<SecurityEvent> it = events.descendingIterator(); it.hasNext(); ) {
        SecurityEvent e = it.next();
        if (!e.timestamp().isAfter(cutoff)) {
          continue;
        }
        if (e.action() == SecurityAction.SETUP && e.adminId().equals(adminId)) {
          attempts++;
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    if (attempts >= config.setupAttemptLimit()) {
      log.warn("Setup throttled for admin from {} after {} attempts", clientAddress, attempts);
      return new SetupDecision(false, SETUP_DENIED_REASON);
    }
    return SetupDecision.ALLOWED;
  }

  public int size() {
    lock.readLock().lock();
    try {
      return events.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Drops every event. For maintenance and tests.
   */
  public void clear() {
    lock.writeLock().lock();
    try {
      events.clear();
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Cleared security events");
  }
}
