package com.codeheadsystems.aegis.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.aegis.otp.TotpGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TwoFactorIntegrationTest {

  @LocalServerPort
  private int port;

  private final ObjectMapper mapper = new ObjectMapper();
  private final TotpGenerator totp = new TotpGenerator();
  private HttpClient httpClient;
  private String userAgent;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    userAgent = "boot-it-" + UUID.randomUUID();
  }

  @Test
  void enrolThenBackupLogin_sessionOpensProtectedEndpoints() throws Exception {
    String adminId = "admin-" + UUID.randomUUID();
    HttpResponse<String> setup = post("/2fa/setup", "{\"adminId\":\"" + adminId + "\",\"accountName\":\"ops@example.com\"}");
    assertThat(setup.statusCode()).isEqualTo(200);
    JsonNode setupBody = mapper.readTree(setup.body());
    String secret = setupBody.get("secret").asText();
    String backupCode = setupBody.get("backupCodes").get(0).asText();
    assertThat(setupBody.get("backupCodes")).hasSize(8);
    assertThat(setupBody.get("provisioningUri").asText()).contains("issuer=Aegis%20Boot");

    HttpResponse<String> confirm = post("/2fa/confirm", codeBody(adminId, totp.codeAt(secret, Instant.now())));
    assertThat(confirm.statusCode()).isEqualTo(200);

    HttpResponse<String> login = post("/2fa/backup", codeBody(adminId, backupCode));
    assertThat(login.statusCode()).isEqualTo(200);
    JsonNode session = mapper.readTree(login.body());
    assertThat(session.get("remainingBackupCodes").asInt()).isEqualTo(7);
    String token = session.get("token").asText();

    HttpResponse<String> events = get("/security/events/" + adminId + "?limit=2", token);
    assertThat(events.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(events.body())).hasSize(2);

    assertThat(get("/security/stats", token).statusCode()).isEqualTo(200);

    HttpResponse<String> whoAmI = get("/api/whoami", token);
    assertThat(whoAmI.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(whoAmI.body()).get("adminId").asText()).isEqualTo(adminId);

    HttpResponse<String> sealed = post("/api/vault/seal", "{\"id\":1,\"description\":\"quarterly figures\"}", token);
    assertThat(sealed.statusCode()).isEqualTo(200);
    assertThat(sealed.body()).doesNotContain("quarterly figures");
    HttpResponse<String> opened = post("/api/vault/open", sealed.body(), token);
    assertThat(mapper.readTree(opened.body()).get("description").asText()).isEqualTo("quarterly figures");
  }

  @Test
  void protectedEndpoints_withoutSession_return401() throws Exception {
    assertThat(get("/security/stats", null).statusCode()).isEqualTo(401);
    assertThat(get("/api/whoami", "not-a-real-token").statusCode()).isEqualTo(401);
  }

  @Test
  void verify_unknownAdmin_returnsGenericAuthenticationFailure() throws Exception {
    HttpResponse<String> response = post("/2fa/verify", codeBody("nobody", "123456"));

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(mapper.readTree(response.body()).get("error").asText()).isEqualTo("Authentication failed");
  }

  @Test
  void verify_malformedCode_returns400() throws Exception {
    HttpResponse<String> response = post("/2fa/verify", codeBody("admin-y", "12ab56"));

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(mapper.readTree(response.body()).get("error").asText())
        .isEqualTo("Invalid request");
  }

  @Test
  void setup_withoutBody_returns400() throws Exception {
    HttpResponse<String> response = post("/2fa/setup", "");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(mapper.readTree(response.body()).get("error").asText()).isEqualTo("Invalid request");
  }

  @Test
  void setup_fourthAttemptIsThrottled() throws Exception {
    String body = "{\"adminId\":\"admin-" + UUID.randomUUID() + "\"}";
    for (int i = 0; i < 3; i++) {
      assertThat(post("/2fa/setup", body).statusCode()).isEqualTo(200);
    }

    HttpResponse<String> throttled = post("/2fa/setup", body);

    assertThat(throttled.statusCode()).isEqualTo(429);
    assertThat(throttled.headers().firstValue("Retry-After")).contains("900");
  }

  @Test
  void health_isUp() throws Exception {
    HttpResponse<String> health = get("/actuator/health", null);

    assertThat(health.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(health.body()).get("status").asText()).isEqualTo("UP");
  }

  private static String codeBody(String adminId, String code) {
    return "{\"adminId\":\"" + adminId + "\",\"code\":\"" + code + "\"}";
  }

  private HttpResponse<String> post(String path, String json) throws Exception {
    return post(path, json, null);
  }

  private HttpResponse<String> post(String path, String json, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Content-Type", "application/json")
        .header("User-Agent", userAgent)
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("User-Agent", userAgent)
        .GET();
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", port);
  }
}
