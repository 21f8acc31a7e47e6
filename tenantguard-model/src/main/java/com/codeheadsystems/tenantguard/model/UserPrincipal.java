package com.codeheadsystems.tenantguard.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A principal backed by a stored user.
 *
 * @param user   the stored user
 * @param tenant the effective tenant: the user's own for session tokens, the token's for API tokens
 * @param scopes scopes from the API token, or null when resolved from a session token
 */
public record UserPrincipal(StoredUser user, Long tenant, Set<String> scopes)
    implements TenantPrincipal {

  public UserPrincipal {
    Objects.requireNonNull(user, "user");
    scopes = scopes == null ? null : Set.copyOf(scopes);
  }

  /**
   * Principal for a signed session token. Carries no scopes.
   *
   * @param user the user named by the token subject
   * @return the principal
   */
  public static UserPrincipal fromSession(StoredUser user) {
    return new UserPrincipal(user, user.tenantId(), null);
  }

  /**
   * Principal for an API token bound to a user.
   *
   * @param user  the token's user
   * @param token the matched token
   * @return the principal, scoped to the token's tenant and scopes
   */
  public static UserPrincipal fromApiToken(StoredUser user, StoredApiToken token) {
    return new UserPrincipal(user, token.tenantId(), token.scopeSet());
  }

  @Override
  public IdentityKind kind() {
    return IdentityKind.PERSISTED_USER;
  }

  @Override
  public Optional<Long> id() {
    return Optional.of(user.id());
  }

  @Override
  public String email() {
    return user.email();
  }

  @Override
  public Role role() {
    return user.role();
  }

  @Override
  public Optional<Long> tenantId() {
    return Optional.ofNullable(tenant);
  }

  @Override
  public Optional<Set<String>> grantedScopes() {
    return Optional.ofNullable(scopes);
  }

  @Override
  public Optional<StoredUser> persistedUser() {
    return Optional.of(user);
  }
}
