package com.codeheadsystems.tenantguard.server.exception;

/**
 * The principal lacks a scope the operation requires. Scope names are not secret, so the message
 * names it.
 */
public class InsufficientScopeException extends AuthException {

  private final String requiredScope;

  public InsufficientScopeException(String requiredScope) {
    super(403, "Token does not have required scope: " + requiredScope);
    this.requiredScope = requiredScope;
  }

  public String requiredScope() {
    return requiredScope;
  }
}
