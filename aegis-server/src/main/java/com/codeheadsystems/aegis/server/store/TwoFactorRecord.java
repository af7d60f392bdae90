package com.codeheadsystems.aegis.server.store;

import java.time.Instant;
import java.util.List;

/**
 * Second-factor enrolment for one administrator account.
 *
 * @param adminId          the account
 * @param encryptedSecret  envelope of the base32 one-time-password secret (secret plane)
 * @param backupCodeHashes bcrypt hashes of the unused backup codes
 * @param enabled          false while setup awaits confirmation
 * @param createdAt        when setup began
 * @param lastUsedCounter  time step of the last accepted code, used to refuse replays
 */
public record TwoFactorRecord(
    String adminId,
    String encryptedSecret,
    List<String> backupCodeHashes,
    boolean enabled,
    Instant createdAt,
    long lastUsedCounter) {

  public TwoFactorRecord {
    backupCodeHashes = List.copyOf(backupCodeHashes);
  }

  public static TwoFactorRecord pending(String adminId, String encryptedSecret, List<String> backupCodeHashes,
                                        Instant createdAt) {
    return new TwoFactorRecord(adminId, encryptedSecret, backupCodeHashes, false, createdAt, -1);
  }

  public TwoFactorRecord asEnabled(long counter) {
    return new TwoFactorRecord(adminId, encryptedSecret, backupCodeHashes, true, createdAt, counter);
  }

  public TwoFactorRecord withLastUsedCounter(long counter) {
    return new TwoFactorRecord(adminId, encryptedSecret, backupCodeHashes, enabled, createdAt, counter);
  }

  public TwoFactorRecord withBackupCodeHashes(List<String> hashes) {
    return new TwoFactorRecord(adminId, encryptedSecret, hashes, enabled, createdAt, lastUsedCounter);
  }
}
