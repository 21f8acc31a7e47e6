package com.codeheadsystems.tenantguard.model;

import java.security.Principal;
import java.util.Optional;
import java.util.Set;

/**
 * The identity resolved from a bearer credential, valid for one request.
 * <p>
 * There are two implementations. {@link UserPrincipal} wraps a stored user. A
 * {@link SyntheticTenantPrincipal} stands in for a tenant-wide API token and has no id. Code that
 * writes rows referencing the caller must go through {@link #persistedUser()}, which is empty for
 * synthetic principals.
 */
public interface TenantPrincipal extends Principal {

  IdentityKind kind();

  /**
   * The user id, absent for synthetic principals.
   */
  Optional<Long> id();

  String email();

  Role role();

  /**
   * The tenant every downstream operation is scoped to. Empty only for a global user resolved
   * from a signed session token.
   */
  Optional<Long> tenantId();

  /**
   * Scopes granted by the API token the principal was resolved from. Empty when the principal
   * came from a signed session token, in which case the role alone gates access.
   */
  Optional<Set<String>> grantedScopes();

  /**
   * The stored user behind this principal, if any.
   */
  Optional<StoredUser> persistedUser();

  @Override
  default String getName() {
    return email();
  }
}
