package com.codeheadsystems.aegis.springboot.config;

import com.codeheadsystems.aegis.crypto.CryptoConfig;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code aegis} prefix. Both passphrases are required and must be at least
 * 32 characters; startup fails otherwise.
 */
@ConfigurationProperties(prefix = "aegis")
public class AegisProperties {

  private String masterEncryptionKey;
  private String encryptionKey;
  private String applicationSalt = "aegis-salt";
  private int masterIterations = CryptoConfig.MIN_PRODUCTION_MASTER_ITERATIONS;
  private int perCallIterations = 10_000;
  private int bcryptCost = 12;
  private String totpIssuer = "Aegis";
  private String fileTokenIssuer = "aegis";
  private Duration sessionTtl = Duration.ofHours(1);
  private Duration sweepInterval = Duration.ofMinutes(5);
  private int maxSecurityEvents = 10_000;
  private final Policy authenticationPolicy = Policy.of(RateLimitPolicy.AUTHENTICATION);
  private final Policy secondFactorPolicy = Policy.of(RateLimitPolicy.SECOND_FACTOR);
  private final Policy adminPolicy = Policy.of(RateLimitPolicy.ADMIN);
  private final Policy generalPolicy = Policy.of(RateLimitPolicy.GENERAL);

  public String getMasterEncryptionKey() {
    return masterEncryptionKey;
  }

  public void setMasterEncryptionKey(String masterEncryptionKey) {
    this.masterEncryptionKey = masterEncryptionKey;
  }

  public String getEncryptionKey() {
    return encryptionKey;
  }

  public void setEncryptionKey(String encryptionKey) {
    this.encryptionKey = encryptionKey;
  }

  public String getApplicationSalt() {
    return applicationSalt;
  }

  public void setApplicationSalt(String applicationSalt) {
    this.applicationSalt = applicationSalt;
  }

  public int getMasterIterations() {
    return masterIterations;
  }

  public void setMasterIterations(int masterIterations) {
    this.masterIterations = masterIterations;
  }

  public int getPerCallIterations() {
    return perCallIterations;
  }

  public void setPerCallIterations(int perCallIterations) {
    this.perCallIterations = perCallIterations;
  }

  public int getBcryptCost() {
    return bcryptCost;
  }

  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  public String getTotpIssuer() {
    return totpIssuer;
  }

  public void setTotpIssuer(String totpIssuer) {
    this.totpIssuer = totpIssuer;
  }

  public String getFileTokenIssuer() {
    return fileTokenIssuer;
  }

  public void setFileTokenIssuer(String fileTokenIssuer) {
    this.fileTokenIssuer = fileTokenIssuer;
  }

  public Duration getSessionTtl() {
    return sessionTtl;
  }

  public void setSessionTtl(Duration sessionTtl) {
    this.sessionTtl = sessionTtl;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public int getMaxSecurityEvents() {
    return maxSecurityEvents;
  }

  public void setMaxSecurityEvents(int maxSecurityEvents) {
    this.maxSecurityEvents = maxSecurityEvents;
  }

  public Policy getAuthenticationPolicy() {
    return authenticationPolicy;
  }

  public Policy getSecondFactorPolicy() {
    return secondFactorPolicy;
  }

  public Policy getAdminPolicy() {
    return adminPolicy;
  }

  public Policy getGeneralPolicy() {
    return generalPolicy;
  }

  public RateLimitPolicies rateLimitPolicies() {
    return new RateLimitPolicies(
        authenticationPolicy.toPolicy(RateLimitPolicy.AUTHENTICATION.name()),
        secondFactorPolicy.toPolicy(RateLimitPolicy.SECOND_FACTOR.name()),
        adminPolicy.toPolicy(RateLimitPolicy.ADMIN.name()),
        generalPolicy.toPolicy(RateLimitPolicy.GENERAL.name()));
  }

  public static class Policy {

    private Duration window;
    private int maxRequests;

    static Policy of(RateLimitPolicy policy) {
      Policy settings = new Policy();
      settings.setWindow(policy.window());
      settings.setMaxRequests(policy.maxRequests());
      return settings;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public int getMaxRequests() {
      return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
      this.maxRequests = maxRequests;
    }

    RateLimitPolicy toPolicy(String name) {
      return new RateLimitPolicy(name, window, maxRequests);
    }
  }
}
