package com.codeheadsystems.aegis.springboot.config;

import com.codeheadsystems.aegis.common.ObjectMappers;
import com.codeheadsystems.aegis.common.RandomProvider;
import com.codeheadsystems.aegis.crypto.CryptoConfig;
import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.crypto.MasterKey;
import com.codeheadsystems.aegis.event.LoggingAlertListener;
import com.codeheadsystems.aegis.event.SecurityEventTracker;
import com.codeheadsystems.aegis.event.TrackerConfig;
import com.codeheadsystems.aegis.field.FieldEncryptionService;
import com.codeheadsystems.aegis.field.FileAccessTokenManager;
import com.codeheadsystems.aegis.otp.TotpGenerator;
import com.codeheadsystems.aegis.ratelimit.ExpiredWindowSweeper;
import com.codeheadsystems.aegis.ratelimit.RateLimitPolicies;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.server.store.AdminSessionStore;
import com.codeheadsystems.aegis.server.store.InMemoryAdminSessionStore;
import com.codeheadsystems.aegis.server.store.InMemoryTwoFactorStore;
import com.codeheadsystems.aegis.server.store.TwoFactorStore;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(AegisProperties.class)
public class AegisAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(AegisAutoConfiguration.class);

  /**
   * Default {@link RandomProvider}. Override this bean to supply a different source, for
   * example an HSM-backed {@link SecureRandom}:
   * <pre>{@code
   *   @Bean
   *   public RandomProvider randomProvider() throws Exception {
   *     return new RandomProvider(SecureRandom.getInstance("NativePRNG"));
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider() {
    return new RandomProvider(new SecureRandom());
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public TwoFactorStore twoFactorStore() {
    log.warn("Using in-memory two-factor store. All enrolments will be lost on restart. Do not use in production.");
    return new InMemoryTwoFactorStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public AdminSessionStore adminSessionStore(Clock clock) {
    log.warn("Using in-memory session store. All sessions will be lost on restart. Do not use in production.");
    return new InMemoryAdminSessionStore(clock);
  }

  /**
   * Derives both master keys. Fails startup with a
   * {@link com.codeheadsystems.aegis.exceptions.ConfigurationException} when either passphrase
   * is missing or shorter than 32 characters.
   */
  @Bean
  @ConditionalOnMissingBean
  public CryptoPlanes cryptoPlanes(AegisProperties props, RandomProvider randomProvider) {
    CryptoConfig secretConfig = cryptoConfig(CryptoConfig.DEFAULT, props, randomProvider);
    CryptoConfig dataConfig = cryptoConfig(CryptoConfig.DATA_PLANE, props, randomProvider);
    MasterKey secretKey = MasterKey.derive("secret", props.getMasterEncryptionKey(), secretConfig);
    MasterKey dataKey = MasterKey.derive("data", props.getEncryptionKey(), dataConfig);
    return new CryptoPlanes(new CryptoCore(secretKey, secretConfig), new CryptoCore(dataKey, dataConfig), dataKey);
  }

  @Bean
  @ConditionalOnMissingBean
  public FieldEncryptionService fieldEncryptionService(CryptoPlanes planes) {
    return new FieldEncryptionService(planes.data(), ObjectMappers.standard());
  }

  @Bean
  @ConditionalOnMissingBean
  public FileAccessTokenManager fileAccessTokenManager(CryptoPlanes planes, AegisProperties props, Clock clock) {
    return new FileAccessTokenManager(planes.dataKey(), ObjectMappers.standard(), clock, props.getFileTokenIssuer());
  }

  @Bean
  @ConditionalOnMissingBean
  public SecurityEventTracker securityEventTracker(AegisProperties props, Clock clock) {
    SecurityEventTracker tracker = new SecurityEventTracker(
        TrackerConfig.DEFAULT.withMaxEvents(props.getMaxSecurityEvents()), clock);
    tracker.addListener(new LoggingAlertListener());
    return tracker;
  }

  @Bean
  @ConditionalOnMissingBean
  public TotpGenerator totpGenerator(AegisProperties props, RandomProvider randomProvider, Clock clock) {
    return new TotpGenerator(randomProvider, clock, props.getTotpIssuer());
  }

  @Bean
  @ConditionalOnMissingBean
  public TwoFactorManager twoFactorManager(CryptoPlanes planes, TotpGenerator totpGenerator,
                                           TwoFactorStore twoFactorStore, AdminSessionStore adminSessionStore,
                                           SecurityEventTracker securityEventTracker, AegisProperties props,
                                           Clock clock) {
    return new TwoFactorManager(planes.secret(), totpGenerator, twoFactorStore, adminSessionStore,
        securityEventTracker, props.getSessionTtl(), TrackerConfig.DEFAULT.window(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter rateLimiter(Clock clock) {
    return new RateLimiter(clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitPolicies rateLimitPolicies(AegisProperties props) {
    return props.rateLimitPolicies();
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public ExpiredWindowSweeper expiredWindowSweeper(RateLimiter rateLimiter, AegisProperties props) {
    return new ExpiredWindowSweeper(rateLimiter, props.getSweepInterval());
  }

  private static CryptoConfig cryptoConfig(CryptoConfig base, AegisProperties props, RandomProvider randomProvider) {
    return base
        .withApplicationSalt(props.getApplicationSalt())
        .withIterations(props.getMasterIterations(), props.getPerCallIterations())
        .withBcryptCost(props.getBcryptCost())
        .withRandomProvider(randomProvider);
  }
}
