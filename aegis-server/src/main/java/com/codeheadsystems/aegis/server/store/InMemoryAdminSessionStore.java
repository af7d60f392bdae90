package com.codeheadsystems.aegis.server.store;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AdminSessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on restart.
 * Suitable for development and integration testing only.
 */
public class InMemoryAdminSessionStore implements AdminSessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAdminSessionStore.class);

  private final ConcurrentHashMap<String, AdminSession> sessions = new ConcurrentHashMap<>();
  // Reverse index: adminId → tokens, kept in sync with sessions.
  private final ConcurrentHashMap<String, Set<String>> adminToTokens = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAdminSessionStore(Clock clock) {
    this.clock = clock;
  }

  public InMemoryAdminSessionStore() {
    this(Clock.systemUTC());
  }

  @Override
  public void store(String token, AdminSession session) {
    sessions.put(token, session);
    adminToTokens.computeIfAbsent(session.adminId(), k -> ConcurrentHashMap.newKeySet()).add(token);
    log.debug("Stored admin session expiresAt={}", session.expiresAt());
  }

  @Override
  public Optional<AdminSession> load(String token) {
    AdminSession session = sessions.get(token);
    if (session == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(session.expiresAt())) {
      revoke(token);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public void revoke(String token) {
    AdminSession session = sessions.remove(token);
    if (session != null) {
      Set<String> tokens = adminToTokens.get(session.adminId());
      if (tokens != null) {
        tokens.remove(token);
      }
    }
  }

  @Override
  public void revokeByAdminId(String adminId) {
    Set<String> tokens = adminToTokens.remove(adminId);
    if (tokens != null) {
      tokens.forEach(sessions::remove);
      log.debug("Revoked {} session(s) for admin", tokens.size());
    }
  }
}
