package com.codeheadsystems.aegis.server.resource;

import com.codeheadsystems.aegis.exceptions.ErrorTranslator;
import com.codeheadsystems.aegis.exceptions.PublicError;
import com.codeheadsystems.aegis.ratelimit.ClientIdentity;
import com.codeheadsystems.aegis.ratelimit.RateLimitDecision;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicy;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the named rate-limit policies to every request before authentication runs. Which
 * policy covers a path is decided by {@link RateLimitPolicies#forPath(String)}.
 * <p>
 * Denied requests get a 429 with a {@code Retry-After} header; allowed ones carry
 * {@code X-RateLimit-*} headers.
 */
@Provider
@Singleton
@Priority(Priorities.AUTHENTICATION - 100)
public class RateLimitFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  public static final String LIMIT_HEADER = "X-RateLimit-Limit";
  public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  public static final String RESET_HEADER = "X-RateLimit-Reset";

  static final String DECISION_PROPERTY = RateLimitFilter.class.getName() + ".decision";

  private final RateLimiter rateLimiter;
  private final RateLimitPolicies policies;

  @Context
  private HttpServletRequest servletRequest;

  @Inject
  public RateLimitFilter(final RateLimiter rateLimiter, final RateLimitPolicies policies) {
    this.rateLimiter = rateLimiter;
    this.policies = policies;
    log.info("RateLimitFilter({})", policies);
  }

  RateLimitFilter(final RateLimiter rateLimiter, final RateLimitPolicies policies,
                  final HttpServletRequest servletRequest) {
    this(rateLimiter, policies);
    this.servletRequest = servletRequest;
  }

  @Override
  public void filter(final ContainerRequestContext request) {
    RateLimitPolicy policy = policies.forPath(request.getUriInfo().getPath());
    ClientIdentity client = new ClientIdentity(
        servletRequest == null ? null : servletRequest.getRemoteAddr(),
        request.getHeaderString(HttpHeaders.USER_AGENT));
    RateLimitDecision decision = rateLimiter.check(policy, client);
    if (decision.allowed()) {
      request.setProperty(DECISION_PROPERTY, decision);
      return;
    }
    log.debug("Rejecting request under policy {}", policy.name());
    request.abortWith(Response.status(429)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .header(HttpHeaders.RETRY_AFTER, decision.retryAfterSeconds())
        .entity(new PublicError(429, ErrorTranslator.TOO_MANY_REQUESTS, decision.retryAfterSeconds()))
        .build());
  }

  @Override
  public void filter(final ContainerRequestContext request, final ContainerResponseContext response) {
    if (!(request.getProperty(DECISION_PROPERTY) instanceof RateLimitDecision decision)) {
      return;
    }
    MultivaluedMap<String, Object> headers = response.getHeaders();
    headers.putSingle(LIMIT_HEADER, decision.limit());
    headers.putSingle(REMAINING_HEADER, decision.remaining());
    headers.putSingle(RESET_HEADER, decision.resetAt().getEpochSecond());
  }
}
