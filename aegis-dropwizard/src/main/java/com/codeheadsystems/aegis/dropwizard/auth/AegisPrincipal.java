package com.codeheadsystems.aegis.dropwizard.auth;

import java.security.Principal;
import java.time.Instant;

/**
 * Principal representing an administrator who passed the second factor.
 *
 * @param adminId   the administrator account
 * @param expiresAt when the backing session ends
 */
public record AegisPrincipal(String adminId, Instant expiresAt) implements Principal {

  @Override
  public String getName() {
    return adminId;
  }
}
