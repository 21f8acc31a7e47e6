package com.codeheadsystems.tenantguard.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;

import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

class BearerUnauthorizedHandlerTest {

  @Test
  void buildResponse_usesUniformMessageAndChallenge() {
    Response response = new BearerUnauthorizedHandler().buildResponse("Bearer", "realm");

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getHeaderString(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
    ErrorMessage body = (ErrorMessage) response.getEntity();
    assertThat(body.getCode()).isEqualTo(401);
    assertThat(body.getMessage()).isEqualTo("Could not validate credentials");
  }
}
