package com.codeheadsystems.aegis.dropwizard;

import com.codeheadsystems.aegis.common.ObjectMappers;
import com.codeheadsystems.aegis.crypto.CryptoConfig;
import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.crypto.MasterKey;
import com.codeheadsystems.aegis.dropwizard.auth.AegisAuthenticator;
import com.codeheadsystems.aegis.dropwizard.auth.AegisPrincipal;
import com.codeheadsystems.aegis.dropwizard.health.CryptoHealthCheck;
import com.codeheadsystems.aegis.dropwizard.lifecycle.ManagedSweeper;
import com.codeheadsystems.aegis.event.LoggingAlertListener;
import com.codeheadsystems.aegis.event.SecurityEventTracker;
import com.codeheadsystems.aegis.event.TrackerConfig;
import com.codeheadsystems.aegis.field.FieldEncryptionService;
import com.codeheadsystems.aegis.field.FileAccessTokenManager;
import com.codeheadsystems.aegis.otp.TotpGenerator;
import com.codeheadsystems.aegis.ratelimit.ExpiredWindowSweeper;
import com.codeheadsystems.aegis.ratelimit.RateLimiter;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.server.resource.AegisExceptionMapper;
import com.codeheadsystems.aegis.server.resource.RateLimitFilter;
import com.codeheadsystems.aegis.server.resource.SecurityEventResource;
import com.codeheadsystems.aegis.server.resource.TwoFactorResource;
import com.codeheadsystems.aegis.server.store.AdminSessionStore;
import com.codeheadsystems.aegis.server.store.InMemoryAdminSessionStore;
import com.codeheadsystems.aegis.server.store.InMemoryTwoFactorStore;
import com.codeheadsystems.aegis.server.store.TwoFactorStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Aegis security subsystem into an existing Dropwizard
 * application.
 * <p>
 * Registers the second-factor and security dashboard resources, the rate-limit filter, the
 * error mapper, a crypto health check, the window sweeper and a bearer-token auth filter for
 * {@link AegisPrincipal}. Requires an {@link AegisConfiguration} in the application's YAML.
 * <p>
 * Embed with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new AegisBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new AegisBundle<>(myTwoFactorStore, mySessionStore));
 * }</pre>
 * After {@code run}, the data-plane services are available to the host application through
 * {@link #fieldEncryptionService()} and {@link #fileAccessTokenManager()}.
 */
@Singleton
public class AegisBundle<C extends AegisConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(AegisBundle.class);

  private final TwoFactorStore twoFactorStore;
  private final AdminSessionStore sessionStore;
  private final Clock clock;

  private FieldEncryptionService fieldEncryptionService;
  private FileAccessTokenManager fileAccessTokenManager;
  private TwoFactorManager twoFactorManager;

  /**
   * Creates a bundle backed by in-memory stores. All enrolments and sessions are lost on
   * restart.
   */
  public AegisBundle() {
    this(new InMemoryTwoFactorStore(), new InMemoryAdminSessionStore(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory two-factor and session stores.       #
        # All enrolments and sessions will be lost on restart.          #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  @Inject
  public AegisBundle(TwoFactorStore twoFactorStore, AdminSessionStore sessionStore) {
    this(twoFactorStore, sessionStore, Clock.systemUTC());
  }

  AegisBundle(TwoFactorStore twoFactorStore, AdminSessionStore sessionStore, Clock clock) {
    this.twoFactorStore = twoFactorStore;
    this.sessionStore = sessionStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    CryptoConfig secretConfig = cryptoConfig(CryptoConfig.DEFAULT, configuration);
    CryptoConfig dataConfig = cryptoConfig(CryptoConfig.DATA_PLANE, configuration);
    // Both derivations throw ConfigurationException for a missing or short passphrase.
    MasterKey secretKey = MasterKey.derive("secret", configuration.getMasterEncryptionKey(), secretConfig);
    MasterKey dataKey = MasterKey.derive("data", configuration.getEncryptionKey(), dataConfig);
    CryptoCore secretCore = new CryptoCore(secretKey, secretConfig);
    CryptoCore dataCore = new CryptoCore(dataKey, dataConfig);

    ObjectMapper objectMapper = ObjectMappers.standard();
    fieldEncryptionService = new FieldEncryptionService(dataCore, objectMapper);
    fileAccessTokenManager = new FileAccessTokenManager(dataKey, objectMapper, clock,
        configuration.getFileTokenIssuer());

    SecurityEventTracker tracker = new SecurityEventTracker(
        TrackerConfig.DEFAULT.withMaxEvents(configuration.getMaxSecurityEvents()), clock);
    tracker.addListener(new LoggingAlertListener());

    twoFactorManager = new TwoFactorManager(secretCore,
        new TotpGenerator(secretConfig.randomProvider(), clock, configuration.getTotpIssuer()),
        twoFactorStore, sessionStore, tracker,
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        TrackerConfig.DEFAULT.window(), clock);

    RateLimiter rateLimiter = new RateLimiter(clock);
    environment.lifecycle().manage(new ManagedSweeper(
        new ExpiredWindowSweeper(rateLimiter, Duration.ofSeconds(configuration.getSweepIntervalSeconds()))));

    environment.jersey().register(new RateLimitFilter(rateLimiter, configuration.rateLimitPolicies()));
    environment.jersey().register(new AegisExceptionMapper());
    environment.jersey().register(new TwoFactorResource(twoFactorManager));
    environment.jersey().register(new SecurityEventResource(twoFactorManager));
    environment.healthChecks().register("aegis-crypto", new CryptoHealthCheck(secretCore, dataCore));

    // Bearer session auth for host application resources
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<AegisPrincipal>()
            .setAuthenticator(new AegisAuthenticator(twoFactorManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(AegisPrincipal.class));
    log.info("AegisBundle started with policies {}", configuration.rateLimitPolicies());
  }

  public FieldEncryptionService fieldEncryptionService() {
    return requireStarted(fieldEncryptionService);
  }

  public FileAccessTokenManager fileAccessTokenManager() {
    return requireStarted(fileAccessTokenManager);
  }

  public TwoFactorManager twoFactorManager() {
    return requireStarted(twoFactorManager);
  }

  private static <T> T requireStarted(T service) {
    if (service == null) {
      throw new IllegalStateException("AegisBundle has not run yet");
    }
    return service;
  }

  private static CryptoConfig cryptoConfig(CryptoConfig base, AegisConfiguration configuration) {
    return base
        .withApplicationSalt(configuration.getApplicationSalt())
        .withIterations(configuration.getMasterIterations(), configuration.getPerCallIterations())
        .withBcryptCost(configuration.getBcryptCost());
  }
}
