package com.codeheadsystems.tenantguard.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTokenManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes();
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private SessionTokenConfig config;
  private SessionTokenManager manager;

  @BeforeEach
  void setUp() {
    config = new SessionTokenConfig(SECRET, SigningAlgorithm.HS256, "test-issuer",
        Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));
    manager = new SessionTokenManager(config);
  }

  @Test
  void issueAndVerify_roundTrip() {
    String token = manager.issueToken("alice@example.com");

    assertThat(manager.verify(token)).contains("alice@example.com");
  }

  @Test
  void issueToken_setsExpiryFromTtl() {
    String token = manager.issueToken("alice@example.com");

    assertThat(JWT.decode(token).getExpiresAtAsInstant()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
    assertThat(JWT.decode(token).getId()).isNotBlank();
  }

  @Test
  void verify_afterExpiry_returnsEmpty() {
    String token = manager.issueToken("alice@example.com");
    SessionTokenManager later = new SessionTokenManager(
        config.withClock(Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC)));

    assertThat(later.verify(token)).isEmpty();
  }

  @Test
  void verify_wrongSecret_returnsEmpty() {
    String token = manager.issueToken("alice@example.com");
    SessionTokenManager other = new SessionTokenManager(new SessionTokenConfig(WRONG_SECRET,
        SigningAlgorithm.HS256, "test-issuer", Duration.ofMinutes(30), config.clock()));

    assertThat(other.verify(token)).isEmpty();
  }

  @Test
  void verify_wrongAlgorithm_returnsEmpty() {
    String token = manager.issueToken("alice@example.com");
    SessionTokenManager other = new SessionTokenManager(new SessionTokenConfig(SECRET,
        SigningAlgorithm.HS512, "test-issuer", Duration.ofMinutes(30), config.clock()));

    assertThat(other.verify(token)).isEmpty();
  }

  @Test
  void verify_wrongIssuer_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("someone-else")
        .withSubject("alice@example.com")
        .withExpiresAt(NOW.plusSeconds(600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(manager.verify(token)).isEmpty();
  }

  @Test
  void verify_missingExpiry_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withSubject("alice@example.com")
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(manager.verify(token)).isEmpty();
  }

  @Test
  void verify_missingSubject_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withExpiresAt(NOW.plusSeconds(600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(manager.verify(token)).isEmpty();
  }

  @Test
  void verify_tamperedToken_returnsEmpty() {
    String token = manager.issueToken("alice@example.com");
    // Flip the first character of the signature part
    int signatureStart = token.lastIndexOf('.') + 1;
    char replacement = token.charAt(signatureStart) == 'A' ? 'B' : 'A';
    String tampered = token.substring(0, signatureStart) + replacement
        + token.substring(signatureStart + 1);

    assertThat(manager.verify(tampered)).isEmpty();
  }

  @Test
  void verify_garbage_returnsEmpty() {
    assertThat(manager.verify("abc123")).isEmpty();
    assertThat(manager.verify("")).isEmpty();
    assertThat(manager.verify(null)).isEmpty();
  }
}
