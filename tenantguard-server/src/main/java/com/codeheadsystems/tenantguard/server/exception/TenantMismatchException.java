package com.codeheadsystems.tenantguard.server.exception;

/**
 * Thrown when a principal scoped to one tenant touches a resource of another tenant.
 */
public class TenantMismatchException extends AuthException {

  private final long resourceTenantId;

  public TenantMismatchException(long resourceTenantId) {
    super(403, "Not allowed to access resources of tenant " + resourceTenantId);
    this.resourceTenantId = resourceTenantId;
  }

  public long resourceTenantId() {
    return resourceTenantId;
  }
}
