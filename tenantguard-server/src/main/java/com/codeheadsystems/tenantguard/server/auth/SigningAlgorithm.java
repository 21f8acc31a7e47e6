package com.codeheadsystems.tenantguard.server.auth;

import com.auth0.jwt.algorithms.Algorithm;
import java.util.Locale;

/**
 * HMAC algorithms accepted for signed session tokens.
 */
public enum SigningAlgorithm {

  HS256,
  HS384,
  HS512;

  /**
   * Builds the java-jwt algorithm for this variant.
   *
   * @param secret shared signing secret
   * @return the algorithm
   */
  public Algorithm toAlgorithm(byte[] secret) {
    return switch (this) {
      case HS256 -> Algorithm.HMAC256(secret);
      case HS384 -> Algorithm.HMAC384(secret);
      case HS512 -> Algorithm.HMAC512(secret);
    };
  }

  /**
   * Looks up an algorithm by its JOSE name.
   *
   * @param name e.g. {@code "HS256"}
   * @return the algorithm
   * @throws IllegalArgumentException if the name is not supported
   */
  public static SigningAlgorithm fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Missing signing algorithm");
    }
    try {
      return SigningAlgorithm.valueOf(name.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported signing algorithm: " + name, e);
    }
  }
}
