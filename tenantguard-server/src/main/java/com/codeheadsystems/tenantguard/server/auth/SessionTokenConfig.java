package com.codeheadsystems.tenantguard.server.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for signing and verifying session tokens.
 *
 * @param secret    HMAC secret, at least {@value #MIN_SECRET_BYTES} bytes
 * @param algorithm HMAC variant
 * @param issuer    value required in the {@code iss} claim
 * @param tokenTtl  lifetime of issued tokens
 * @param clock     time source for issuing and for expiry checks
 */
public record SessionTokenConfig(byte[] secret,
                                 SigningAlgorithm algorithm,
                                 String issuer,
                                 Duration tokenTtl,
                                 Clock clock) {

  public static final int MIN_SECRET_BYTES = 32;
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

  public SessionTokenConfig {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(tokenTtl, "tokenTtl");
    Objects.requireNonNull(clock, "clock");
    if (secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "Signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (issuer == null || issuer.isBlank()) {
      throw new IllegalArgumentException("Missing issuer");
    }
    if (tokenTtl.isNegative() || tokenTtl.isZero()) {
      throw new IllegalArgumentException("Token TTL must be positive");
    }
    secret = secret.clone();
  }

  /**
   * HS256 with a 30 minute TTL on the system UTC clock.
   *
   * @param secret HMAC secret
   * @param issuer issuer claim
   * @return the config
   */
  public static SessionTokenConfig of(byte[] secret, String issuer) {
    return new SessionTokenConfig(secret, SigningAlgorithm.HS256, issuer, DEFAULT_TTL,
        Clock.systemUTC());
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  /**
   * Same settings on a different clock.
   *
   * @param other the clock to use
   * @return a new config
   */
  public SessionTokenConfig withClock(Clock other) {
    return new SessionTokenConfig(secret, algorithm, issuer, tokenTtl, other);
  }

  @Override
  public String toString() {
    return "SessionTokenConfig[algorithm=" + algorithm + ", issuer=" + issuer
        + ", tokenTtl=" + tokenTtl + "]";
  }
}
