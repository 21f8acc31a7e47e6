package com.codeheadsystems.tenantguard.server.exception;

/**
 * The credential was missing, malformed, expired, or matched nothing. The message never says
 * which.
 */
public class UnauthenticatedException extends AuthException {

  public static final String MESSAGE = "Could not validate credentials";

  public UnauthenticatedException() {
    super(401, MESSAGE);
  }
}
