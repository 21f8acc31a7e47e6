package com.codeheadsystems.tenantguard.model;

import java.util.Optional;
import java.util.Set;

/**
 * Stand-in principal for an API token that belongs to a tenant but to no user.
 * <p>
 * Always {@link Role#API_USER}, never has an id, and exposes no {@link StoredUser}, so it cannot
 * be used as a foreign key.
 *
 * @param tenant the token's tenant
 * @param scopes the token's scopes
 */
public record SyntheticTenantPrincipal(long tenant, Set<String> scopes) implements TenantPrincipal {

  /**
   * Placeholder email reported for synthetic principals.
   */
  public static final String EMAIL = "api-token@system";

  public SyntheticTenantPrincipal {
    scopes = Set.copyOf(scopes);
  }

  /**
   * Builds the principal for a tenant-wide token.
   *
   * @param token the matched token, which must have no user
   * @return the principal
   */
  public static SyntheticTenantPrincipal fromApiToken(StoredApiToken token) {
    if (!token.isTenantWide()) {
      throw new IllegalArgumentException("Token " + token.id() + " is bound to a user");
    }
    return new SyntheticTenantPrincipal(token.tenantId(), token.scopeSet());
  }

  @Override
  public IdentityKind kind() {
    return IdentityKind.SYNTHETIC_TENANT_PRINCIPAL;
  }

  @Override
  public Optional<Long> id() {
    return Optional.empty();
  }

  @Override
  public String email() {
    return EMAIL;
  }

  @Override
  public Role role() {
    return Role.API_USER;
  }

  @Override
  public Optional<Long> tenantId() {
    return Optional.of(tenant);
  }

  @Override
  public Optional<Set<String>> grantedScopes() {
    return Optional.of(scopes);
  }

  @Override
  public Optional<StoredUser> persistedUser() {
    return Optional.empty();
  }
}
