package com.codeheadsystems.tenantguard.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SessionTokenConfigTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();

  @Test
  void shortSecret_throwsIAE() {
    assertThatThrownBy(() -> SessionTokenConfig.of("too-short".getBytes(), "issuer"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("at least 32 bytes");
  }

  @Test
  void blankIssuer_throwsIAE() {
    assertThatThrownBy(() -> SessionTokenConfig.of(SECRET, " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("issuer");
  }

  @Test
  void zeroTtl_throwsIAE() {
    assertThatThrownBy(() -> new SessionTokenConfig(SECRET, SigningAlgorithm.HS256, "issuer",
        Duration.ZERO, Clock.systemUTC()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void secret_isDefensivelyCopied() {
    byte[] secret = SECRET.clone();
    SessionTokenConfig config = SessionTokenConfig.of(secret, "issuer");
    secret[0] = 0;
    config.secret()[1] = 0;

    assertThat(config.secret()).isEqualTo(SECRET);
  }

  @Test
  void toString_doesNotLeakSecret() {
    assertThat(SessionTokenConfig.of(SECRET, "issuer").toString())
        .doesNotContain("test-secret")
        .contains("HS256");
  }

  @Test
  void signingAlgorithm_fromName() {
    assertThat(SigningAlgorithm.fromName("hs384")).isEqualTo(SigningAlgorithm.HS384);
    assertThatThrownBy(() -> SigningAlgorithm.fromName("RS256"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported");
  }
}
