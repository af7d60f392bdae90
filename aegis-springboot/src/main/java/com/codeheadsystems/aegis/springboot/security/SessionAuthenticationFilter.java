package com.codeheadsystems.aegis.springboot.security;

import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code Authorization: Bearer <session token>} into an {@link AegisPrincipal}.
 * Requests without a live session pass through unauthenticated.
 */
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private final TwoFactorManager twoFactorManager;

  public SessionAuthenticationFilter(TwoFactorManager twoFactorManager) {
    this.twoFactorManager = twoFactorManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith("Bearer ")) {
      String token = authHeader.substring(7).trim();
      twoFactorManager.authenticate(token).ifPresent(session -> {
        AegisPrincipal principal = new AegisPrincipal(session.adminId(), session.expiresAt());
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(principal, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      });
    }
    filterChain.doFilter(request, response);
  }
}
