package com.codeheadsystems.aegis.springboot.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private RateLimitFilter filter;

  @BeforeEach
  void setUp() {
    RateLimiter rateLimiter = new RateLimiter(Clock.fixed(NOW, ZoneOffset.UTC));
    filter = new RateLimitFilter(rateLimiter, RateLimitPolicies.DEFAULT);
  }

  @Test
  void allowedRequest_setsHeadersAndContinues() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("/2fa/verify"), response, chain);

    assertThat(chain.getRequest()).isNotNull();
    assertThat(response.getHeader(RateLimitFilter.LIMIT_HEADER)).isEqualTo("3");
    assertThat(response.getHeader(RateLimitFilter.REMAINING_HEADER)).isEqualTo("2");
    assertThat(response.getHeader(RateLimitFilter.RESET_HEADER))
        .isEqualTo(String.valueOf(NOW.plusSeconds(300).getEpochSecond()));
  }

  @Test
  void exhaustedPolicy_writes429WithoutCallingChain() throws Exception {
    for (int i = 0; i < 3; i++) {
      filter.doFilter(request("/2fa/verify"), new MockHttpServletResponse(), new MockFilterChain());
    }
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("/2fa/verify"), response, chain);

    assertThat(chain.getRequest()).isNull();
    assertThat(response.getStatus()).isEqualTo(429);
    assertThat(response.getHeader("Retry-After")).isEqualTo("300");
    assertThat(response.getContentAsString())
        .contains("\"error\":\"Too many requests\"")
        .contains("\"retryAfter\":300");
  }

  @Test
  void contextPathIsIgnoredWhenChoosingPolicy() throws Exception {
    MockHttpServletRequest request = request("/app/security/stats");
    request.setContextPath("/app");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, new MockFilterChain());

    assertThat(response.getHeader(RateLimitFilter.LIMIT_HEADER)).isEqualTo("100");
  }

  private static MockHttpServletRequest request(String uri) {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
    request.setRemoteAddr("10.1.2.3");
    request.addHeader("User-Agent", "unit-test");
    return request;
  }
}
