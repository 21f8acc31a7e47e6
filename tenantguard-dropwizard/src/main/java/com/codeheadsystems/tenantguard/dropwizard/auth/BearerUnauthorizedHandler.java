package com.codeheadsystems.tenantguard.dropwizard.auth;

import com.codeheadsystems.tenantguard.server.exception.UnauthenticatedException;
import io.dropwizard.auth.UnauthorizedHandler;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * 401 response for missing or rejected bearer credentials, with the same body as
 * {@link UnauthenticatedException} so clients cannot tell the failure paths apart.
 */
public class BearerUnauthorizedHandler implements UnauthorizedHandler {

  @Override
  public Response buildResponse(String prefix, String realm) {
    return Response.status(Response.Status.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, prefix)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorMessage(Response.Status.UNAUTHORIZED.getStatusCode(),
            UnauthenticatedException.MESSAGE))
        .build();
  }
}
