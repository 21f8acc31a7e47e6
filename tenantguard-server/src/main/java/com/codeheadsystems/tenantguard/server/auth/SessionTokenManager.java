package com.codeheadsystems.tenantguard.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs and verifies the HMAC session tokens handed out at login.
 * <p>
 * Verification checks the signature, the issuer, and the expiry against the configured clock, and
 * requires both {@code sub} and {@code exp}. Any failure yields an empty result; the reason is
 * only logged at debug level so callers cannot tell a bad signature from an expired token.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionTokenConfig config;
  private final Clock clock;

  /**
   * Creates a new SessionTokenManager.
   *
   * @param config signing secret, algorithm, issuer, TTL and clock
   */
  public SessionTokenManager(SessionTokenConfig config) {
    this.config = config;
    this.clock = config.clock();
    this.algorithm = config.algorithm().toAlgorithm(config.secret());
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(config.issuer())
        .withClaimPresence("sub")
        .withClaimPresence("exp"))
        .build(clock);
  }

  /**
   * Issues a session token for the given subject (the user's email).
   *
   * @param subject the {@code sub} claim
   * @return signed token
   */
  public String issueToken(String subject) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("Missing subject");
    }
    Instant now = clock.instant();
    String jti = UUID.randomUUID().toString();
    String token = JWT.create()
        .withIssuer(config.issuer())
        .withJWTId(jti)
        .withSubject(subject)
        .withIssuedAt(now)
        .withExpiresAt(now.plus(config.tokenTtl()))
        .sign(algorithm);
    log.debug("Issued session token jti={}", jti);
    return token;
  }

  /**
   * Verifies a session token.
   *
   * @param token compact JWT
   * @return the subject if the token is intact, unexpired and from this issuer; otherwise empty
   */
  public Optional<String> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String subject = decoded.getSubject();
      if (subject == null || subject.isBlank()) {
        log.debug("Session token jti={} has a blank subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(subject);
    } catch (JWTVerificationException e) {
      log.debug("Session token verification failed: {}", e.getClass().getSimpleName());
      return Optional.empty();
    }
  }

  /**
   * The settings this manager was built with.
   *
   * @return the config
   */
  public SessionTokenConfig config() {
    return config;
  }
}
