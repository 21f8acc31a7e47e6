package com.codeheadsystems.tenantguard.dropwizard.auth;

import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.server.resolver.PrincipalResolver;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} for user-session resources. Accepts only session tokens, for
 * active users of any role.
 * <p>
 * Use in place of {@link TenantGuardAuthenticator} in applications that serve a user-facing UI:
 * <pre>{@code
 *   new OAuthCredentialAuthFilter.Builder<TenantPrincipal>()
 *       .setAuthenticator(new SessionTokenAuthenticator(bundle.getPrincipalResolver()))
 *       .setPrefix("Bearer")
 *       .buildAuthFilter();
 * }</pre>
 */
public class SessionTokenAuthenticator implements Authenticator<String, TenantPrincipal> {

  private final PrincipalResolver resolver;

  public SessionTokenAuthenticator(PrincipalResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public Optional<TenantPrincipal> authenticate(String credentials) throws AuthenticationException {
    return resolver.resolveSession(credentials);
  }
}
