package com.codeheadsystems.aegis.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.aegis.otp.TotpGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the full second-factor flow: setup, confirm, backup-code login, then
 * protected endpoints with the issued session token.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class TwoFactorIntegrationTest {

  static final DropwizardAppExtension<AegisConfiguration> APP =
      new DropwizardAppExtension<>(
          AegisApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private final ObjectMapper mapper = new ObjectMapper();
  private final TotpGenerator totp = new TotpGenerator();
  private HttpClient httpClient;
  // Each test gets its own client signature so rate-limit counters do not interfere.
  private String userAgent;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    userAgent = "it-" + UUID.randomUUID();
  }

  @Test
  void setupConfirmBackupLogin_thenProtectedEndpointsAcceptSession() throws Exception {
    String adminId = "admin-" + UUID.randomUUID();
    HttpResponse<String> setup = post("/2fa/setup", "{\"adminId\":\"" + adminId + "\"}");
    assertThat(setup.statusCode()).isEqualTo(200);
    JsonNode setupBody = mapper.readTree(setup.body());
    String secret = setupBody.get("secret").asText();
    String backupCode = setupBody.get("backupCodes").get(0).asText();
    assertThat(setupBody.get("provisioningUri").asText()).startsWith("otpauth://totp/Aegis%20IT:");

    HttpResponse<String> confirm = post("/2fa/confirm", codeBody(adminId, totp.codeAt(secret, Instant.now())));
    assertThat(confirm.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(confirm.body()).get("enabled").asBoolean()).isTrue();

    HttpResponse<String> login = post("/2fa/backup", codeBody(adminId, backupCode));
    assertThat(login.statusCode()).isEqualTo(200);
    JsonNode session = mapper.readTree(login.body());
    assertThat(session.get("remainingBackupCodes").asInt()).isEqualTo(7);
    String token = session.get("token").asText();

    HttpResponse<String> stats = get("/security/stats", token);
    assertThat(stats.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(stats.body()).get("last24Hours").get("totalEvents").asInt()).isPositive();

    HttpResponse<String> events = get("/security/events/" + adminId, token);
    assertThat(events.statusCode()).isEqualTo(200);
    JsonNode eventList = mapper.readTree(events.body());
    assertThat(eventList).hasSize(3);
    assertThat(eventList.get(0).get("action").asText()).isEqualTo("backup-used");

    HttpResponse<String> whoAmI = get("/api/whoami", token);
    assertThat(whoAmI.statusCode()).isEqualTo(200);
    assertThat(whoAmI.body()).contains(adminId);

    // The same backup code does not work twice.
    assertThat(post("/2fa/backup", codeBody(adminId, backupCode)).statusCode()).isEqualTo(401);
  }

  @Test
  void protectedEndpoints_withoutSession_return401WithGenericError() throws Exception {
    HttpResponse<String> stats = get("/security/stats", null);
    assertThat(stats.statusCode()).isEqualTo(401);
    assertThat(mapper.readTree(stats.body()).get("error").asText()).isEqualTo("Authentication failed");

    assertThat(get("/api/whoami", "f".repeat(64)).statusCode()).isEqualTo(401);
  }

  @Test
  void verify_unknownAdmin_returns401() throws Exception {
    HttpResponse<String> response = post("/2fa/verify", codeBody("nobody", "123456"));

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).doesNotContain("nobody");
  }

  @Test
  void verify_malformedCode_returns400() throws Exception {
    HttpResponse<String> response = post("/2fa/verify", codeBody("admin-x", "abc"));

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(mapper.readTree(response.body()).get("error").asText())
        .isEqualTo("Invalid request");
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
    assertThat(mapper.readTree(throttled.body()).get("retryAfter").asLong()).isEqualTo(900);
  }

  @Test
  void vault_sealsAndOpensRecordFields() throws Exception {
    String adminId = "admin-" + UUID.randomUUID();
    JsonNode setupBody = mapper.readTree(post("/2fa/setup", "{\"adminId\":\"" + adminId + "\"}").body());
    post("/2fa/confirm", codeBody(adminId, totp.codeAt(setupBody.get("secret").asText(), Instant.now())));
    String token = mapper.readTree(
        post("/2fa/backup", codeBody(adminId, setupBody.get("backupCodes").get(1).asText())).body())
        .get("token").asText();

    HttpResponse<String> sealed = post("/api/vault/seal", "{\"id\":7,\"description\":\"secret-description\"}", token);
    assertThat(sealed.statusCode()).isEqualTo(200);
    JsonNode sealedBody = mapper.readTree(sealed.body());
    assertThat(sealedBody.has("description")).isFalse();
    assertThat(sealedBody.get("description_is_encrypted").asBoolean()).isTrue();

    HttpResponse<String> opened = post("/api/vault/open", sealed.body(), token);
    assertThat(mapper.readTree(opened.body()).get("description").asText()).isEqualTo("secret-description");
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
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
