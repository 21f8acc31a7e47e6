package com.codeheadsystems.tenantguard.server.resolver;

import com.codeheadsystems.tenantguard.model.StoredApiToken;
import com.codeheadsystems.tenantguard.model.StoredUser;
import com.codeheadsystems.tenantguard.model.SyntheticTenantPrincipal;
import com.codeheadsystems.tenantguard.model.TenantPrincipal;
import com.codeheadsystems.tenantguard.model.UserPrincipal;
import com.codeheadsystems.tenantguard.server.auth.SessionTokenManager;
import com.codeheadsystems.tenantguard.server.exception.UnauthenticatedException;
import com.codeheadsystems.tenantguard.server.store.UserStore;
import com.codeheadsystems.tenantguard.server.token.ApiTokenMatcher;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw bearer credential into a {@link TenantPrincipal}.
 * <p>
 * Two call sites are supported:
 * <ul>
 *   <li>{@link #resolve}/{@link #authenticate}: API-gated operations. A signed session token is
 *   tried first and accepted only for an active user in the API tier; otherwise the credential
 *   is matched against stored API tokens.</li>
 *   <li>{@link #resolveSession}/{@link #authenticateSession}: user-session operations. Only
 *   signed session tokens are accepted, for an active user of any role.</li>
 * </ul>
 * Each path reports failure as an empty result and the paths are combined in order, so the
 * only failure that leaves this class is a plain {@link UnauthenticatedException}. Exceptions
 * from the stores are not caught.
 */
public class PrincipalResolver {

  private static final Logger log = LoggerFactory.getLogger(PrincipalResolver.class);

  private final SessionTokenManager sessionTokenManager;
  private final ApiTokenMatcher apiTokenMatcher;
  private final UserStore userStore;

  /**
   * Instantiates a new resolver.
   *
   * @param sessionTokenManager verifier for signed session tokens
   * @param apiTokenMatcher     matcher for opaque API tokens
   * @param userStore           user lookups
   */
  public PrincipalResolver(SessionTokenManager sessionTokenManager,
                           ApiTokenMatcher apiTokenMatcher,
                           UserStore userStore) {
    this.sessionTokenManager = Objects.requireNonNull(sessionTokenManager, "sessionTokenManager");
    this.apiTokenMatcher = Objects.requireNonNull(apiTokenMatcher, "apiTokenMatcher");
    this.userStore = Objects.requireNonNull(userStore, "userStore");
  }

  /**
   * Resolves a credential for an API-gated operation.
   *
   * @param credential bearer credential, without the {@code Bearer} prefix
   * @return the principal, or empty if neither path accepts the credential
   */
  public Optional<TenantPrincipal> resolve(String credential) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }
    return fromSessionToken(credential, true)
        .or(() -> fromApiToken(credential));
  }

  /**
   * Like {@link #resolve} but fails with an exception.
   *
   * @param credential bearer credential
   * @return the principal
   * @throws UnauthenticatedException if the credential resolves to nothing
   */
  public TenantPrincipal authenticate(String credential) {
    return resolve(credential).orElseThrow(UnauthenticatedException::new);
  }

  /**
   * Resolves a credential for a user-session operation. API tokens are not accepted.
   *
   * @param credential bearer credential
   * @return the principal, or empty
   */
  public Optional<TenantPrincipal> resolveSession(String credential) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }
    return fromSessionToken(credential, false);
  }

  /**
   * Like {@link #resolveSession} but fails with an exception.
   *
   * @param credential bearer credential
   * @return the principal
   * @throws UnauthenticatedException if the credential is not a valid session token for an
   *                                  active user
   */
  public TenantPrincipal authenticateSession(String credential) {
    return resolveSession(credential).orElseThrow(UnauthenticatedException::new);
  }

  private Optional<TenantPrincipal> fromSessionToken(String credential, boolean apiTierOnly) {
    return sessionTokenManager.verify(credential)
        .flatMap(userStore::findByEmail)
        .filter(StoredUser::active)
        .filter(user -> !apiTierOnly || user.role().isApiTier())
        .map(UserPrincipal::fromSession);
  }

  private Optional<TenantPrincipal> fromApiToken(String credential) {
    Optional<StoredApiToken> matched = apiTokenMatcher.match(credential);
    if (matched.isEmpty()) {
      return Optional.empty();
    }
    StoredApiToken token = matched.get();
    try {
      token.scopeSet();
    } catch (IllegalArgumentException e) {
      log.warn("API token id={} has unreadable scopes; rejecting", token.id());
      return Optional.empty();
    }
    if (token.isTenantWide()) {
      return Optional.of(SyntheticTenantPrincipal.fromApiToken(token));
    }
    Optional<StoredUser> user = userStore.findById(token.userId()).filter(StoredUser::active);
    if (user.isEmpty()) {
      log.debug("API token id={} belongs to a missing or inactive user", token.id());
      return Optional.empty();
    }
    Long userTenant = user.get().tenantId();
    if (userTenant != null && userTenant != token.tenantId()) {
      log.warn("API token id={} is for tenant {} but its user belongs to tenant {}; rejecting",
          token.id(), token.tenantId(), userTenant);
      return Optional.empty();
    }
    return Optional.of(UserPrincipal.fromApiToken(user.get(), token));
  }
}
