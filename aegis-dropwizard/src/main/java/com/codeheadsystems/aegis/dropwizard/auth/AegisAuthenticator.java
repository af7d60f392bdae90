package com.codeheadsystems.aegis.dropwizard.auth;

import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves bearer session tokens through
 * {@link TwoFactorManager#authenticate(String)}.
 */
public class AegisAuthenticator implements Authenticator<String, AegisPrincipal> {

  private final TwoFactorManager twoFactorManager;

  public AegisAuthenticator(TwoFactorManager twoFactorManager) {
    this.twoFactorManager = twoFactorManager;
  }

  @Override
  public Optional<AegisPrincipal> authenticate(String token) throws AuthenticationException {
    return twoFactorManager.authenticate(token)
        .map(session -> new AegisPrincipal(session.adminId(), session.expiresAt()));
  }
}
