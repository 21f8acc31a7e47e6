package com.codeheadsystems.tenantguard.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * An opaque API token record as returned by the storage layer.
 * <p>
 * Only the one-way hash of the secret is stored, so a token can be identified only by verifying a
 * presented secret against {@link #tokenHash()}. Scopes are kept in their serialized JSON form;
 * use {@link #scopeSet()} to read them.
 *
 * @param id        primary key
 * @param name      display name
 * @param tokenHash bcrypt hash of the secret
 * @param scopes    JSON array of scope names, e.g. {@code ["health:read"]}
 * @param active    whether the token is enabled
 * @param expiresAt expiry instant, or null for a token that never expires
 * @param tenantId  owning tenant (mandatory)
 * @param userId    owning user, or null for a tenant-wide token
 */
public record StoredApiToken(long id,
                             String name,
                             String tokenHash,
                             String scopes,
                             boolean active,
                             Instant expiresAt,
                             long tenantId,
                             Long userId) {

  public StoredApiToken {
    Objects.requireNonNull(tokenHash, "tokenHash");
    Objects.requireNonNull(scopes, "scopes");
  }

  /**
   * Whether the token has an expiry that lies strictly before {@code now}.
   *
   * @param now the reference instant
   * @return true when the token must be treated as absent
   */
  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && expiresAt.isBefore(now);
  }

  /**
   * Whether the token is bound to a tenant only.
   *
   * @return true when no user is associated with the token
   */
  public boolean isTenantWide() {
    return userId == null;
  }

  /**
   * Parses the serialized scopes.
   *
   * @return the unmodifiable scope set, in stored order
   * @throws IllegalArgumentException if the stored value is not a JSON array of strings
   */
  public Set<String> scopeSet() {
    return TokenScopes.parse(scopes);
  }
}
