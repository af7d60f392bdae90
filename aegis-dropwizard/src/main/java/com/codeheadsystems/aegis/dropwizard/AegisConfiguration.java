package com.codeheadsystems.aegis.dropwizard;

import com.codeheadsystems.aegis.crypto.CryptoConfig;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Dropwizard configuration for the Aegis security subsystem.
 * <p>
 * Both passphrases are required and must be at least 32 characters. The secret plane protects
 * one-time-password secrets; the data plane protects record fields and files. Keep them
 * different. Changing either passphrase, or the application salt, makes existing ciphertext
 * undecryptable.
 */
public class AegisConfiguration extends Configuration {

  /**
   * Passphrase for the secret-plane master key.
   */
  @NotEmpty
  private String masterEncryptionKey;

  /**
   * Passphrase for the data-plane master key.
   */
  @NotEmpty
  private String encryptionKey;

  @NotEmpty
  private String applicationSalt = "aegis-salt";

  /**
   * PBKDF2 iterations for master key derivation. Values below 100000 log a warning.
   */
  @Min(1)
  private int masterIterations = CryptoConfig.MIN_PRODUCTION_MASTER_ITERATIONS;

  @Min(1)
  private int perCallIterations = 10_000;

  @Min(4)
  @Max(31)
  private int bcryptCost = 12;

  @NotEmpty
  private String totpIssuer = "Aegis";

  @NotEmpty
  private String fileTokenIssuer = "aegis";

  @Min(1)
  private long sessionTtlSeconds = 3600;

  @Min(1)
  private long sweepIntervalSeconds = 300;

  @Min(1)
  private int maxSecurityEvents = 10_000;

  @Valid
  @NotNull
  private PolicySettings authenticationPolicy = PolicySettings.of(RateLimitPolicy.AUTHENTICATION);

  @Valid
  @NotNull
  private PolicySettings secondFactorPolicy = PolicySettings.of(RateLimitPolicy.SECOND_FACTOR);

  @Valid
  @NotNull
  private PolicySettings adminPolicy = PolicySettings.of(RateLimitPolicy.ADMIN);

  @Valid
  @NotNull
  private PolicySettings generalPolicy = PolicySettings.of(RateLimitPolicy.GENERAL);

  @JsonProperty
  public String getMasterEncryptionKey() {
    return masterEncryptionKey;
  }

  @JsonProperty
  public void setMasterEncryptionKey(String masterEncryptionKey) {
    this.masterEncryptionKey = masterEncryptionKey;
  }

  @JsonProperty
  public String getEncryptionKey() {
    return encryptionKey;
  }

  @JsonProperty
  public void setEncryptionKey(String encryptionKey) {
    this.encryptionKey = encryptionKey;
  }

  @JsonProperty
  public String getApplicationSalt() {
    return applicationSalt;
  }

  @JsonProperty
  public void setApplicationSalt(String applicationSalt) {
    this.applicationSalt = applicationSalt;
  }

  @JsonProperty
  public int getMasterIterations() {
    return masterIterations;
  }

  @JsonProperty
  public void setMasterIterations(int masterIterations) {
    this.masterIterations = masterIterations;
  }

  @JsonProperty
  public int getPerCallIterations() {
    return perCallIterations;
  }

  @JsonProperty
  public void setPerCallIterations(int perCallIterations) {
    this.perCallIterations = perCallIterations;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  @JsonProperty
  public String getTotpIssuer() {
    return totpIssuer;
  }

  @JsonProperty
  public void setTotpIssuer(String totpIssuer) {
    this.totpIssuer = totpIssuer;
  }

  @JsonProperty
  public String getFileTokenIssuer() {
    return fileTokenIssuer;
  }

  @JsonProperty
  public void setFileTokenIssuer(String fileTokenIssuer) {
    this.fileTokenIssuer = fileTokenIssuer;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  @JsonProperty
  public int getMaxSecurityEvents() {
    return maxSecurityEvents;
  }

  @JsonProperty
  public void setMaxSecurityEvents(int maxSecurityEvents) {
    this.maxSecurityEvents = maxSecurityEvents;
  }

  @JsonProperty
  public PolicySettings getAuthenticationPolicy() {
    return authenticationPolicy;
  }

  @JsonProperty
  public void setAuthenticationPolicy(PolicySettings authenticationPolicy) {
    this.authenticationPolicy = authenticationPolicy;
  }

  @JsonProperty
  public PolicySettings getSecondFactorPolicy() {
    return secondFactorPolicy;
  }

  @JsonProperty
  public void setSecondFactorPolicy(PolicySettings secondFactorPolicy) {
    this.secondFactorPolicy = secondFactorPolicy;
  }

  @JsonProperty
  public PolicySettings getAdminPolicy() {
    return adminPolicy;
  }

  @JsonProperty
  public void setAdminPolicy(PolicySettings adminPolicy) {
    this.adminPolicy = adminPolicy;
  }

  @JsonProperty
  public PolicySettings getGeneralPolicy() {
    return generalPolicy;
  }

  @JsonProperty
  public void setGeneralPolicy(PolicySettings generalPolicy) {
    this.generalPolicy = generalPolicy;
  }

  /**
   * The configured policy set.
   */
  public RateLimitPolicies rateLimitPolicies() {
    return new RateLimitPolicies(
        authenticationPolicy.toPolicy(RateLimitPolicy.AUTHENTICATION.name()),
        secondFactorPolicy.toPolicy(RateLimitPolicy.SECOND_FACTOR.name()),
        adminPolicy.toPolicy(RateLimitPolicy.ADMIN.name()),
        generalPolicy.toPolicy(RateLimitPolicy.GENERAL.name()));
  }

  /**
   * One rate-limit policy: a fixed window and the requests allowed in it.
   */
  public static class PolicySettings {

    @Min(1)
    private long windowSeconds;

    @Min(1)
    private int maxRequests;

    public PolicySettings() {
    }

    public PolicySettings(long windowSeconds, int maxRequests) {
      this.windowSeconds = windowSeconds;
      this.maxRequests = maxRequests;
    }

    static PolicySettings of(RateLimitPolicy policy) {
      return new PolicySettings(policy.window().toSeconds(), policy.maxRequests());
    }

    @JsonProperty
    public long getWindowSeconds() {
      return windowSeconds;
    }

    @JsonProperty
    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    @JsonProperty
    public int getMaxRequests() {
      return maxRequests;
    }

    @JsonProperty
    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }

    RateLimitPolicy toPolicy(String name) {
      return new RateLimitPolicy(name, Duration.ofSeconds(windowSeconds), maxRequests);
    }
  }
}
