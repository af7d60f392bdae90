package com.codeheadsystems.aegis.server.store;

import java.util.Optional;

/**
 * Storage abstraction for administrator sessions keyed by session token.
 * <p>
 * Implementations must be thread-safe. Disabling two-factor authentication for an account must
 * end all of its sessions, so implementations keep whatever index makes
 * {@link #revokeByAdminId(String)} cheap.
 */
public interface AdminSessionStore {

  void store(String token, AdminSession session);

  /**
   * Loads a session, returning empty if not found or expired.
   */
  Optional<AdminSession> load(String token);

  void revoke(String token);

  /**
   * Revokes every session of an account. Does nothing if it has none.
   */
  void revokeByAdminId(String adminId);
}
