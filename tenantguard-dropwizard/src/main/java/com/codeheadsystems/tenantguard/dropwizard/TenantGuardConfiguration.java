package com.codeheadsystems.tenantguard.dropwizard;

import com.codeheadsystems.tenantguard.server.token.ApiTokenHasher;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for bearer credential resolution.
 * <p>
 * For production, supply {@code jwtSecretHex} (at least 32 bytes, hex-encoded) so that session
 * tokens survive restarts and are accepted by every node. Omitting it causes a random secret to
 * be generated on each startup (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class TenantGuardConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC signing secret for session tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * HMAC algorithm for session tokens. Valid values: {@code HS256} (default), {@code HS384},
   * {@code HS512}.
   */
  @NotEmpty
  private String jwtAlgorithm = "HS256";

  /**
   * Session token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 1800;

  /**
   * Issuer claim written into and required from session tokens.
   */
  @NotEmpty
  private String jwtIssuer = "tenantguard";

  /**
   * bcrypt cost for newly hashed API token secrets. Existing hashes keep their own cost.
   */
  @Min(ApiTokenHasher.MIN_COST)
  @Max(ApiTokenHasher.MAX_COST)
  private int tokenHashCost = ApiTokenHasher.DEFAULT_COST;

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt algorithm.
   *
   * @return the jwt algorithm
   */
  @JsonProperty
  public String getJwtAlgorithm() {
    return jwtAlgorithm;
  }

  /**
   * Sets jwt algorithm.
   *
   * @param jwtAlgorithm the jwt algorithm
   */
  @JsonProperty
  public void setJwtAlgorithm(String jwtAlgorithm) {
    this.jwtAlgorithm = jwtAlgorithm;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets token hash cost.
   *
   * @return the token hash cost
   */
  @JsonProperty
  public int getTokenHashCost() {
    return tokenHashCost;
  }

  /**
   * Sets token hash cost.
   *
   * @param tokenHashCost the token hash cost
   */
  @JsonProperty
  public void setTokenHashCost(int tokenHashCost) {
    this.tokenHashCost = tokenHashCost;
  }
}
