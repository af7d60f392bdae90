package com.codeheadsystems.aegis.springboot.security;

import java.security.Principal;
import java.time.Instant;

public record AegisPrincipal(String adminId, Instant expiresAt) implements Principal {

  @Override
  public String getName() {
    return adminId;
  }
}
