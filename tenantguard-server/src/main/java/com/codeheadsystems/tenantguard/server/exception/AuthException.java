package com.codeheadsystems.tenantguard.server.exception;

/**
 * Base of the authentication and authorization failures that cross the resolver boundary.
 * <p>
 * Each subtype carries the HTTP status a boundary should answer with. Messages are safe to show
 * to the caller.
 */
public abstract class AuthException extends RuntimeException {

  private final int status;

  protected AuthException(int status, String message) {
    super(message);
    this.status = status;
  }

  /**
   * The HTTP status for this failure.
   *
   * @return 401, 403 or 404
   */
  public int status() {
    return status;
  }
}
