package com.codeheadsystems.tenantguard.server.exception;

/**
 * A referenced tenant, user or token does not exist in storage.
 */
public class EntityNotFoundException extends AuthException {

  public EntityNotFoundException(String entity, long id) {
    super(404, entity + " not found: " + id);
  }
}
