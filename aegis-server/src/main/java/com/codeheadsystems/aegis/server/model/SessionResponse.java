package com.codeheadsystems.aegis.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Issued after a successful second factor.
 *
 * @param token                 bearer session token
 * @param expiresAt             session expiry
 * @param remainingBackupCodes  unused backup codes left; only present after a backup-code login
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
    @JsonProperty("token") String token,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("remainingBackupCodes") Integer remainingBackupCodes) {

  public SessionResponse(String token, Instant expiresAt) {
    this(token, expiresAt, null);
  }
}
