package com.codeheadsystems.aegis.server.store;

import java.time.Instant;

/**
 * An administrator session opened after a successful second factor.
 *
 * @param adminId   the account
 * @param issuedAt  when the session was created
 * @param expiresAt when the session expires
 */
public record AdminSession(String adminId, Instant issuedAt, Instant expiresAt) {
}
