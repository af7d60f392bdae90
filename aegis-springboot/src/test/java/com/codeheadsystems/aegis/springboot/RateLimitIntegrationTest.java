package com.codeheadsystems.aegis.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RateLimitIntegrationTest {

  @LocalServerPort
  private int port;

  private final ObjectMapper mapper = new ObjectMapper();
  private HttpClient httpClient;
  private String userAgent;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    userAgent = "boot-rl-" + UUID.randomUUID();
  }

  @Test
  void secondFactorPolicy_allowsThreeThenReturns429() throws Exception {
    for (int i = 0; i < 3; i++) {
      HttpResponse<String> response = verify();
      assertThat(response.statusCode()).isEqualTo(401);
      assertThat(response.headers().firstValue("X-RateLimit-Limit")).contains("3");
      assertThat(response.headers().firstValue("X-RateLimit-Remaining")).contains(String.valueOf(2 - i));
    }

    HttpResponse<String> limited = verify();

    assertThat(limited.statusCode()).isEqualTo(429);
    JsonNode body = mapper.readTree(limited.body());
    assertThat(body.get("error").asText()).isEqualTo("Too many requests");
    assertThat(limited.headers().firstValue("Retry-After")).contains(body.get("retryAfter").asText());
  }

  @Test
  void unauthenticatedRequests_stillCountAgainstTheAdminPolicy() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/security/stats", port)))
        .header("User-Agent", userAgent)
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("X-RateLimit-Limit")).contains("100");
    assertThat(response.headers().firstValue("X-RateLimit-Remaining")).contains("99");
  }

  private HttpResponse<String> verify() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/2fa/verify", port)))
        .header("Content-Type", "application/json")
        .header("User-Agent", userAgent)
        .POST(HttpRequest.BodyPublishers.ofString("{\"adminId\":\"ghost\",\"code\":\"123456\"}"))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }
}
