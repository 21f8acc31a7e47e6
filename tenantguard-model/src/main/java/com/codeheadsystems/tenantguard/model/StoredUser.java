package com.codeheadsystems.tenantguard.model;

import java.util.Objects;

/**
 * A user row as returned by the storage layer. Never mutated by the resolver.
 *
 * @param id       primary key
 * @param email    unique login email, also the subject of signed session tokens
 * @param fullName display name
 * @param role     role tier
 * @param tenantId owning tenant, or null for global users such as the super admin
 * @param active   whether the account may authenticate
 */
public record StoredUser(long id,
                         String email,
                         String fullName,
                         Role role,
                         Long tenantId,
                         boolean active) {

  public StoredUser {
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(role, "role");
  }
}
