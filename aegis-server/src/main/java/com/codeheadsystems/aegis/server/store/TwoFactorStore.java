package com.codeheadsystems.aegis.server.store;

import java.util.Optional;

/**
 * Storage abstraction for second-factor enrolments.
 * <p>
 * Implementations must be thread-safe. Secrets arrive already encrypted and backup codes
 * already hashed; a store never sees plaintext.
 */
public interface TwoFactorStore {

  /**
   * Stores or replaces the enrolment for {@link TwoFactorRecord#adminId()}.
   *
   * @param record the enrolment
   */
  void store(TwoFactorRecord record);

  /**
   * Atomically swaps {@code expected} for {@code updated}, only if the stored enrolment still
   * equals {@code expected}. Concurrent callers holding the same snapshot see exactly one win.
   *
   * @param expected the enrolment as previously loaded
   * @param updated  its replacement, for the same account
   * @return true if the swap happened
   */
  boolean replace(TwoFactorRecord expected, TwoFactorRecord updated);

  /**
   * Loads the enrolment for an account.
   *
   * @param adminId the account
   * @return the enrolment, or empty if none exists
   */
  Optional<TwoFactorRecord> load(String adminId);

  /**
   * Removes an enrolment. Does nothing if none exists.
   *
   * @param adminId the account
   */
  void delete(String adminId);
}
