package com.codeheadsystems.aegis.server.manager;

import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.event.SecurityAction;
import com.codeheadsystems.aegis.event.SecurityEvent;
import com.codeheadsystems.aegis.event.SecurityEventTracker;
import com.codeheadsystems.aegis.event.SecurityStats;
import com.codeheadsystems.aegis.event.SetupDecision;
import com.codeheadsystems.aegis.exceptions.ThrottledException;
import com.codeheadsystems.aegis.exceptions.ValidationException;
import com.codeheadsystems.aegis.otp.TotpGenerator;
import com.codeheadsystems.aegis.ratelimit.ClientIdentity;
import com.codeheadsystems.aegis.server.model.SessionResponse;
import com.codeheadsystems.aegis.server.model.SetupResponse;
import com.codeheadsystems.aegis.server.model.StatusResponse;
import com.codeheadsystems.aegis.server.store.AdminSession;
import com.codeheadsystems.aegis.server.store.AdminSessionStore;
import com.codeheadsystems.aegis.server.store.TwoFactorRecord;
import com.codeheadsystems.aegis.server.store.TwoFactorStore;
import com.codeheadsystems.aegis.validation.SecurityValidator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic orchestration of administrator second-factor authentication.
 * <p>
 * Ties the secret-plane {@link CryptoCore}, the {@link TotpGenerator}, the stores and the
 * {@link SecurityEventTracker} together so that the JAX-RS resource and the Spring controller
 * stay thin wrappers. Every attempt, successful or not, is recorded with the tracker.
 * <p>
 * <strong>Exception contract</strong> (callers map these through
 * {@link com.codeheadsystems.aegis.exceptions.ErrorTranslator}):
 * <ul>
 *   <li>{@link IllegalArgumentException}: bad / missing request data → HTTP 400</li>
 *   <li>{@link SecurityException}: wrong code, unknown account, bad session → HTTP 401</li>
 *   <li>{@link ThrottledException}: too many setup attempts → HTTP 429</li>
 * </ul>
 */
public class TwoFactorManager {

  private static final Logger log = LoggerFactory.getLogger(TwoFactorManager.class);

  /**
   * Default administrator session lifetime.
   */
  public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(1);

  private static final String AUTHENTICATION_FAILED = "Authentication failed";

  private final CryptoCore secretCore;
  private final TotpGenerator totpGenerator;
  private final TwoFactorStore twoFactorStore;
  private final AdminSessionStore sessionStore;
  private final SecurityEventTracker tracker;
  private final Duration sessionTtl;
  private final Duration setupRetryHint;
  private final Clock clock;

  /**
   * Creates the manager.
   *
   * @param secretCore     crypto core bound to the secret-plane master key
   * @param totpGenerator  one-time-password generator
   * @param twoFactorStore enrolment store
   * @param sessionStore   administrator session store
   * @param tracker        security event tracker
   * @param sessionTtl     lifetime of issued sessions
   * @param setupRetryHint Retry-After hint returned when setup is throttled
   * @param clock          time source
   */
  public TwoFactorManager(CryptoCore secretCore,
                          TotpGenerator totpGenerator,
                          TwoFactorStore twoFactorStore,
                          AdminSessionStore sessionStore,
                          SecurityEventTracker tracker,
                          Duration sessionTtl,
                          Duration setupRetryHint,
                          Clock clock) {
    this.secretCore = secretCore;
    this.totpGenerator = totpGenerator;
    this.twoFactorStore = twoFactorStore;
    this.sessionStore = sessionStore;
    this.tracker = tracker;
    this.sessionTtl = sessionTtl;
    this.setupRetryHint = setupRetryHint;
    this.clock = clock;
    log.info("TwoFactorManager({}, sessionTtl={})", secretCore, sessionTtl);
  }

  // ── Enrolment ─────────────────────────────────────────────────────────────

  /**
   * Begins enrolment: creates a fresh secret and backup codes and stores them pending
   * confirmation. Replaces any earlier unconfirmed enrolment.
   *
   * @param adminId     the administrator account
   * @param accountName authenticator label, or null to use the admin id
   * @param client      the caller
   * @return the secret, provisioning URI and backup codes, shown once
   */
  public SetupResponse beginSetup(String adminId, String accountName, ClientIdentity client) {
    log.debug("beginSetup()");
    SecurityValidator.requireNonBlank(adminId, "adminId");

    SetupDecision decision = tracker.validateSetupAttempt(adminId, client.address());
    if (!decision.allowed()) {
      throw new ThrottledException(decision.reason(), setupRetryHint.toSeconds());
    }
    if (twoFactorStore.load(adminId).map(TwoFactorRecord::enabled).orElse(false)) {
      tracker.record(adminId, client, SecurityAction.SETUP, false);
      throw new ValidationException("Two-factor authentication is already enabled");
    }

    String secret = totpGenerator.generateSecret();
    List<String> backupCodes = secretCore.generateBackupCodes();
    List<String> hashes = backupCodes.stream().map(secretCore::hashBackupCode).toList();
    twoFactorStore.store(TwoFactorRecord.pending(
        adminId, secretCore.encryptToString(secret), hashes, clock.instant()));
    tracker.record(adminId, client, SecurityAction.SETUP, true);

    String label = accountName == null || accountName.isBlank() ? adminId : accountName;
    return new SetupResponse(secret, totpGenerator.provisioningUri(label, secret), backupCodes);
  }

  /**
   * Confirms a pending enrolment with the first code from the authenticator app.
   */
  public StatusResponse confirmSetup(String adminId, String code, ClientIdentity client) {
    log.debug("confirmSetup()");
    SecurityValidator.requireNonBlank(adminId, "adminId");
    requireTotpFormat(code);

    TwoFactorRecord record = twoFactorStore.load(adminId)
        .filter(r -> !r.enabled())
        .orElseThrow(() -> new ValidationException("No pending two-factor setup"));
    OptionalLong counter = match(record, code);
    if (counter.isEmpty()) {
      tracker.record(adminId, client, SecurityAction.VERIFY, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    if (!twoFactorStore.replace(record, record.asEnabled(counter.getAsLong()))) {
      tracker.record(adminId, client, SecurityAction.VERIFY, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    tracker.record(adminId, client, SecurityAction.VERIFY, true);
    log.info("Two-factor authentication enabled for admin {}", abbreviate(adminId));
    return new StatusResponse(adminId, true);
  }

  // ── Authentication ────────────────────────────────────────────────────────

  /**
   * Verifies a one-time password and opens a session. A code whose time step was already used
   * is refused.
   */
  public SessionResponse verify(String adminId, String code, ClientIdentity client) {
    log.debug("verify()");
    SecurityValidator.requireNonBlank(adminId, "adminId");
    requireTotpFormat(code);

    TwoFactorRecord record = enabledRecord(adminId, client, SecurityAction.VERIFY);
    OptionalLong counter = match(record, code);
    if (counter.isEmpty() || counter.getAsLong() <= record.lastUsedCounter()) {
      tracker.record(adminId, client, SecurityAction.VERIFY, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    if (!twoFactorStore.replace(record, record.withLastUsedCounter(counter.getAsLong()))) {
      log.warn("Concurrent use of the same code for admin {}", abbreviate(adminId));
      tracker.record(adminId, client, SecurityAction.VERIFY, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    tracker.record(adminId, client, SecurityAction.VERIFY, true);
    return openSession(adminId);
  }

  /**
   * Consumes a backup code and opens a session. Each code works once, also under concurrent
   * submission: only the caller whose store swap succeeds gets a session.
   */
  public SessionResponse verifyBackupCode(String adminId, String code, ClientIdentity client) {
    log.debug("verifyBackupCode()");
    SecurityValidator.requireNonBlank(adminId, "adminId");
    Optional<String> normalized = SecurityValidator.normalizeBackupCode(code);
    if (normalized.isEmpty()) {
      tracker.record(adminId, client, SecurityAction.BACKUP_USED, false);
      throw new ValidationException("Invalid backup code format");
    }

    TwoFactorRecord record = enabledRecord(adminId, client, SecurityAction.BACKUP_USED);
    List<String> remaining = new ArrayList<>(record.backupCodeHashes());
    String matched = remaining.stream()
        .filter(hash -> secretCore.verifyBackupCode(normalized.get(), hash))
        .findFirst()
        .orElse(null);
    if (matched == null) {
      tracker.record(adminId, client, SecurityAction.BACKUP_USED, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    remaining.remove(matched);
    if (!twoFactorStore.replace(record, record.withBackupCodeHashes(remaining))) {
      log.warn("Concurrent use of a backup code for admin {}", abbreviate(adminId));
      tracker.record(adminId, client, SecurityAction.BACKUP_USED, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    tracker.record(adminId, client, SecurityAction.BACKUP_USED, true);
    log.info("Backup code consumed for admin {}, {} remaining", abbreviate(adminId), remaining.size());

    SessionResponse session = openSession(adminId);
    return new SessionResponse(session.token(), session.expiresAt(), remaining.size());
  }

  /**
   * Turns the second factor off after a final one-time password check and ends every session
   * of the account.
   */
  public StatusResponse disable(String adminId, String code, ClientIdentity client) {
    log.debug("disable()");
    SecurityValidator.requireNonBlank(adminId, "adminId");
    requireTotpFormat(code);

    TwoFactorRecord record = enabledRecord(adminId, client, SecurityAction.DISABLED);
    OptionalLong counter = match(record, code);
    if (counter.isEmpty()) {
      tracker.record(adminId, client, SecurityAction.DISABLED, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    twoFactorStore.delete(adminId);
    sessionStore.revokeByAdminId(adminId);
    tracker.record(adminId, client, SecurityAction.DISABLED, true);
    log.info("Two-factor authentication disabled for admin {}", abbreviate(adminId));
    return new StatusResponse(adminId, false);
  }

  // ── Sessions ──────────────────────────────────────────────────────────────

  /**
   * Resolves a bearer session token.
   *
   * @param token the token, possibly null
   * @return the live session, or empty for malformed, unknown or expired tokens
   */
  public Optional<AdminSession> authenticate(String token) {
    if (!SecurityValidator.isValidSessionToken(token)) {
      return Optional.empty();
    }
    return sessionStore.load(token);
  }

  /**
   * Like {@link #authenticate(String)} but for an {@code Authorization} header value.
   *
   * @throws SecurityException when the header is missing or the session is not live
   */
  public AdminSession requireSession(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith("Bearer ")) {
      throw new SecurityException("Missing bearer token");
    }
    return authenticate(authorizationHeader.substring("Bearer ".length()).trim())
        .orElseThrow(() -> new SecurityException("Invalid or expired session"));
  }

  public void logout(String token) {
    if (SecurityValidator.isValidSessionToken(token)) {
      sessionStore.revoke(token);
    }
  }

  // ── Reporting ─────────────────────────────────────────────────────────────

  public List<SecurityEvent> events(String adminId, int limit) {
    SecurityValidator.requireNonBlank(adminId, "adminId");
    if (limit <= 0) {
      throw new ValidationException("limit must be positive");
    }
    return tracker.getEventsFor(adminId, limit);
  }

  public SecurityStats stats() {
    return tracker.getStats();
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private TwoFactorRecord enabledRecord(String adminId, ClientIdentity client, SecurityAction action) {
    Optional<TwoFactorRecord> record = twoFactorStore.load(adminId).filter(TwoFactorRecord::enabled);
    if (record.isEmpty()) {
      // Same outcome as a wrong code so enrolment state is not disclosed.
      tracker.record(adminId, client, action, false);
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    return record.get();
  }

  private OptionalLong match(TwoFactorRecord record, String code) {
    String secret = secretCore.decryptToString(record.encryptedSecret());
    return totpGenerator.matchCounter(secret, code);
  }

  private SessionResponse openSession(String adminId) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(sessionTtl);
    String token = secretCore.generateSessionToken();
    sessionStore.store(token, new AdminSession(adminId, now, expiresAt));
    return new SessionResponse(token, expiresAt);
  }

  private static void requireTotpFormat(String code) {
    if (!SecurityValidator.isValidTotpCode(code)) {
      throw new ValidationException("Invalid verification code format");
    }
  }

  private static String abbreviate(String adminId) {
    return adminId.length() <= 8 ? adminId : adminId.substring(0, 8) + "...";
  }
}
