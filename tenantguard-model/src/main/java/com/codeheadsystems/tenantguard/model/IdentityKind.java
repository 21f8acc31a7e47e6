package com.codeheadsystems.tenantguard.model;

/**
 * Distinguishes principals backed by a stored user row from principals synthesized for
 * tenant-wide API tokens.
 */
public enum IdentityKind {

  /**
   * The principal wraps a row from the user store and has a usable id.
   */
  PERSISTED_USER,

  /**
   * The principal was built from an API token with no user. It has no id and must never be
   * written back to storage.
   */
  SYNTHETIC_TENANT_PRINCIPAL
}
