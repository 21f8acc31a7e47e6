package com.codeheadsystems.tenantguard.model;

import java.util.Locale;

/**
 * Coarse role tiers a stored user (or synthesized principal) can hold.
 * <p>
 * {@link #SUPER_ADMIN}, {@link #TENANT_ADMIN} and {@link #API_USER} form the API tier: a signed
 * session token for one of these roles is accepted on API-gated operations. {@link #USER} is a
 * session-only role.
 */
public enum Role {

  SUPER_ADMIN,
  TENANT_ADMIN,
  USER,
  API_USER;

  /**
   * Whether a principal holding this role may call API-gated operations without an explicit
   * scope list.
   *
   * @return true for every role except {@link #USER}
   */
  public boolean isApiTier() {
    return this != USER;
  }

  /**
   * Looks up a role by name, case-insensitively.
   *
   * @param name the role name, e.g. {@code "TENANT_ADMIN"}
   * @return the matching role
   * @throws IllegalArgumentException if the name is null or unknown
   */
  public static Role fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Missing role name");
    }
    try {
      return Role.valueOf(name.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown role: " + name, e);
    }
  }
}
