package com.codeheadsystems.tenantguard.server.exception;

import com.codeheadsystems.tenantguard.model.Role;

/**
 * The principal's role does not satisfy the operation's role requirement.
 */
public class InsufficientRoleException extends AuthException {

  private final Role requiredRole;

  /**
   * @param requiredRole the role the operation required, or null for the API tier check
   */
  public InsufficientRoleException(Role requiredRole) {
    super(403, "Not enough permissions");
    this.requiredRole = requiredRole;
  }

  public Role requiredRole() {
    return requiredRole;
  }
}
