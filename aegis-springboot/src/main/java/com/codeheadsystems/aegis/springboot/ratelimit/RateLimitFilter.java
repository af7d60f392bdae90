package com.codeheadsystems.aegis.springboot.ratelimit;

import com.codeheadsystems.aegis.common.ObjectMappers;
import com.codeheadsystems.aegis.exceptions.ErrorTranslator;
import com.codeheadsystems.aegis.exceptions.PublicError;
import com.codeheadsystems.aegis.ratelimit.RateLimitDecision;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicy;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import com.codeheadsystems.aegis.server.resource.ClientIdentities;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet counterpart of the JAX-RS rate-limit filter. Runs ahead of session authentication, so
 * failed logins count against the client too.
 */
public class RateLimitFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  public static final String LIMIT_HEADER = "X-RateLimit-Limit";
  public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  public static final String RESET_HEADER = "X-RateLimit-Reset";

  private final RateLimiter rateLimiter;
  private final RateLimitPolicies policies;
  private final ObjectMapper objectMapper = ObjectMappers.standard();

  public RateLimitFilter(RateLimiter rateLimiter, RateLimitPolicies policies) {
    this.rateLimiter = rateLimiter;
    this.policies = policies;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    RateLimitPolicy policy = policies.forPath(path);
    RateLimitDecision decision = rateLimiter.check(policy, ClientIdentities.from(request));
    if (!decision.allowed()) {
      log.debug("Rejecting request under policy {}", policy.name());
      response.setStatus(429);
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
      objectMapper.writeValue(response.getOutputStream(),
          new PublicError(429, ErrorTranslator.TOO_MANY_REQUESTS, decision.retryAfterSeconds()));
      return;
    }
    // Set before the chain runs; the response may be committed by the time it returns.
    response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
    response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
    response.setHeader(RESET_HEADER, String.valueOf(decision.resetAt().getEpochSecond()));
    filterChain.doFilter(request, response);
  }
}
