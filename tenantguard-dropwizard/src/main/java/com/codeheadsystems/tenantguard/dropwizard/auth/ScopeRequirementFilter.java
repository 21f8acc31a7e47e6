package com.codeheadsystems.tenantguard.dropwizard.auth;

import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.server.exception.UnauthenticatedException;
import com.codeheadsystems.tenantguard.server.policy.AuthorizationPolicy;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import java.security.Principal;

/**
 * Checks one scope against the principal set by the auth filter. Runs at
 * {@link jakarta.ws.rs.Priorities#AUTHORIZATION}, after authentication.
 */
public class ScopeRequirementFilter implements ContainerRequestFilter {

  private final String scope;

  public ScopeRequirementFilter(String scope) {
    this.scope = scope;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    Principal principal = requestContext.getSecurityContext() == null
        ? null
        : requestContext.getSecurityContext().getUserPrincipal();
    if (!(principal instanceof TenantPrincipal tenantPrincipal)) {
      throw new UnauthenticatedException();
    }
    AuthorizationPolicy.requireScope(tenantPrincipal, scope);
  }

  public String scope() {
    return scope;
  }
}
