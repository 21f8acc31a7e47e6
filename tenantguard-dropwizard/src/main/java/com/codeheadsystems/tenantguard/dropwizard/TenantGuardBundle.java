package com.codeheadsystems.tenantguard.dropwizard;

import com.codeheadsystems.tenantguard.dropwizard.auth.BearerUnauthorizedHandler;
import com.codeheadsystems.tenantguard.dropwizard.auth.ScopeRequirementFeature;
import com.codeheadsystems.tenantguard.dropwizard.auth.TenantGuardAuthenticator;
import com.codeheadsystems.tenantguard.dropwizard.auth.TenantGuardAuthorizer;
import com.codeheadsystems.tenantguard.dropwizard.errors.AuthExceptionMapper;
import com.codeheadsystems.tenantguard.dropwizard.health.SigningKeyHealthCheck;
import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.server.auth.SessionTokenConfig;
import com.codeheadsystems.tenantguard.server.auth.SessionTokenManager;
import com.codeheadsystems.tenantguard.server.auth.SigningAlgorithm;
import com.codeheadsystems.tenantguard.server.resolver.PrincipalResolver;
import com.codeheadsystems.tenantguard.server.store.ApiTokenStore;
import com.codeheadsystems.tenantguard.server.store.InMemoryApiTokenStore;
import com.codeheadsystems.tenantguard.server.store.InMemoryUserStore;
import com.codeheadsystems.tenantguard.server.store.UserStore;
import com.codeheadsystems.tenantguard.server.token.ApiTokenHasher;
import com.codeheadsystems.tenantguard.server.token.ApiTokenMatcher;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts bearer credential resolution in front of an application's resources.
 * <p>
 * Registers the bearer auth filter, {@code @RolesAllowed} and {@code @RequiresScope} enforcement,
 * the exception mapper for authorization failures, and the signing-key health check. Requires a
 * {@link TenantGuardConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TenantGuardBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new TenantGuardBundle<>(myUserStore, myApiTokenStore));
 * }</pre>
 * Resources then declare {@code @Auth TenantPrincipal principal} parameters.
 */
public class TenantGuardBundle<C extends TenantGuardConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TenantGuardBundle.class);

  private final UserStore userStore;
  private final ApiTokenStore apiTokenStore;
  private final Clock clock;

  private SessionTokenManager sessionTokenManager;
  private ApiTokenHasher apiTokenHasher;
  private PrincipalResolver principalResolver;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only. Users and tokens have to be seeded on every start.
   */
  public TenantGuardBundle() {
    this(new InMemoryUserStore(), new InMemoryApiTokenStore());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory user and API token stores.           #
        # All data will be lost on restart.                             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param userStore     user lookups
   * @param apiTokenStore API token records
   */
  public TenantGuardBundle(UserStore userStore, ApiTokenStore apiTokenStore) {
    this(userStore, apiTokenStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied stores and clock.
   *
   * @param userStore     user lookups
   * @param apiTokenStore API token records
   * @param clock         clock for token expiry checks
   */
  public TenantGuardBundle(UserStore userStore, ApiTokenStore apiTokenStore, Clock clock) {
    this.userStore = Objects.requireNonNull(userStore, "userStore");
    this.apiTokenStore = Objects.requireNonNull(apiTokenStore, "apiTokenStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    sessionTokenManager = new SessionTokenManager(buildSessionTokenConfig(configuration));
    apiTokenHasher = new ApiTokenHasher(configuration.getTokenHashCost());
    principalResolver = new PrincipalResolver(sessionTokenManager,
        new ApiTokenMatcher(apiTokenStore, apiTokenHasher, clock), userStore);

    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TenantPrincipal>()
            .setAuthenticator(new TenantGuardAuthenticator(principalResolver))
            .setAuthorizer(new TenantGuardAuthorizer())
            .setUnauthorizedHandler(new BearerUnauthorizedHandler())
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TenantPrincipal.class));
    environment.jersey().register(new ScopeRequirementFeature());
    environment.jersey().register(new AuthExceptionMapper());

    environment.healthChecks().register("signing-key", new SigningKeyHealthCheck(sessionTokenManager));
  }

  private SessionTokenConfig buildSessionTokenConfig(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured - generating randomly. "
          + "Session tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[SessionTokenConfig.MIN_SECRET_BYTES];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    try {
      return new SessionTokenConfig(secret,
          SigningAlgorithm.fromName(configuration.getJwtAlgorithm()),
          configuration.getJwtIssuer(),
          Duration.ofSeconds(configuration.getJwtTtlSeconds()),
          clock);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid session token configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Gets the session token manager, for login endpoints that issue tokens.
   *
   * @return the session token manager
   */
  public SessionTokenManager getSessionTokenManager() {
    return requireStarted(sessionTokenManager);
  }

  /**
   * Gets the API token hasher, for endpoints that create API tokens.
   *
   * @return the API token hasher
   */
  public ApiTokenHasher getApiTokenHasher() {
    return requireStarted(apiTokenHasher);
  }

  /**
   * Gets the principal resolver, for resources that authenticate outside the auth filter.
   *
   * @return the principal resolver
   */
  public PrincipalResolver getPrincipalResolver() {
    return requireStarted(principalResolver);
  }

  private static <T> T requireStarted(T component) {
    if (component == null) {
      throw new IllegalStateException("TenantGuardBundle has not been run yet");
    }
    return component;
  }
}
