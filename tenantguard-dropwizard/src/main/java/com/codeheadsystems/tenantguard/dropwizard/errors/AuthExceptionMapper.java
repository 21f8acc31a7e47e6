package com.codeheadsystems.tenantguard.dropwizard.errors;

import com.codeheadsystems.tenantguard.server.exception.AuthException;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link AuthException} to its HTTP status with an {@link ErrorMessage} body.
 * 401 responses carry a {@code WWW-Authenticate: Bearer} challenge.
 */
@Provider
public class AuthExceptionMapper implements ExceptionMapper<AuthException> {

  private static final Logger log = LoggerFactory.getLogger(AuthExceptionMapper.class);

  @Override
  public Response toResponse(AuthException exception) {
    int status = exception.status();
    log.debug("Request rejected with {}: {}", status, exception.getMessage());
    Response.ResponseBuilder builder = Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorMessage(status, exception.getMessage()));
    if (status == Response.Status.UNAUTHORIZED.getStatusCode()) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    }
    return builder.build();
  }
}
