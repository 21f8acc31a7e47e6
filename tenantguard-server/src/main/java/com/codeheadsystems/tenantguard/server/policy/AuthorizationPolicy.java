package com.codeheadsystems.tenantguard.server.policy;

import com.codeheadsystems.tenantguard.model.Role;
import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.server.exception.InsufficientRoleException;
import com.codeheadsystems.tenantguard.server.exception.InsufficientScopeException;
import com.codeheadsystems.tenantguard.server.exception.TenantMismatchException;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization checks applied to a resolved principal before business logic runs.
 * <p>
 * The checks are independent; an operation picks the ones it needs. Every failure is a
 * 403-class exception.
 */
public final class AuthorizationPolicy {

  private AuthorizationPolicy() {
    // utility class
  }

  /**
   * Requires the principal to hold exactly the given role. Scopes are ignored.
   *
   * @param principal the resolved principal
   * @param required  the role the operation is restricted to
   * @throws InsufficientRoleException if the role differs
   */
  public static void requireRole(TenantPrincipal principal, Role required) {
    if (principal.role() != required) {
      throw new InsufficientRoleException(required);
    }
  }

  /**
   * Requires the principal's role to be in the API tier (anything but {@link Role#USER}).
   *
   * @param principal the resolved principal
   * @throws InsufficientRoleException if the principal is a plain user
   */
  public static void requireApiAccess(TenantPrincipal principal) {
    if (!principal.role().isApiTier()) {
      throw new InsufficientRoleException(null);
    }
  }

  /**
   * Requires a scope.
   * <p>
   * A principal resolved from an API token must list the scope among its granted scopes,
   * whatever its role. A principal resolved from a session token carries no scope list and
   * passes only when its role is in the API tier.
   *
   * @param principal the resolved principal
   * @param scope     the scope the operation requires
   * @throws InsufficientScopeException if the scope is not granted
   */
  public static void requireScope(TenantPrincipal principal, String scope) {
    Optional<Set<String>> granted = principal.grantedScopes();
    boolean allowed = granted
        .map(scopes -> scopes.contains(scope))
        .orElseGet(() -> principal.role().isApiTier());
    if (!allowed) {
      throw new InsufficientScopeException(scope);
    }
  }

  /**
   * Requires the principal to be scoped to the resource's tenant. A super admin without a tenant
   * may access every tenant.
   *
   * @param principal        the resolved principal
   * @param resourceTenantId the tenant owning the resource
   * @throws TenantMismatchException if the tenants differ
   */
  public static void requireTenantAccess(TenantPrincipal principal, long resourceTenantId) {
    Optional<Long> tenant = principal.tenantId();
    if (tenant.isEmpty() && principal.role() == Role.SUPER_ADMIN) {
      return;
    }
    if (tenant.isEmpty() || tenant.get() != resourceTenantId) {
      throw new TenantMismatchException(resourceTenantId);
    }
  }
}
