package com.codeheadsystems.tenantguard.dropwizard.auth;

import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.server.resolver.PrincipalResolver;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} for API-gated resources. Accepts session tokens of API-tier
 * users and API tokens.
 */
public class TenantGuardAuthenticator implements Authenticator<String, TenantPrincipal> {

  private final PrincipalResolver resolver;

  /**
   * Instantiates a new authenticator.
   *
   * @param resolver the principal resolver
   */
  public TenantGuardAuthenticator(PrincipalResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public Optional<TenantPrincipal> authenticate(String credentials) throws AuthenticationException {
    return resolver.resolve(credentials);
  }
}
