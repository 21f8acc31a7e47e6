package com.codeheadsystems.tenantguard.dropwizard.auth;

import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Backs {@code @RolesAllowed} with exact role-name matches. Roles are not hierarchical:
 * {@code @RolesAllowed("TENANT_ADMIN")} does not admit a super admin.
 */
public class TenantGuardAuthorizer implements Authorizer<TenantPrincipal> {

  @Override
  public boolean authorize(TenantPrincipal principal, String role, ContainerRequestContext requestContext) {
    return principal.role().name().equals(role);
  }
}
