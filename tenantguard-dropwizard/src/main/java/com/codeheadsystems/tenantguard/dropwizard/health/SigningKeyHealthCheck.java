package com.codeheadsystems.tenantguard.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tenantguard.server.auth.SessionTokenManager;
import java.util.Optional;

/**
 * Health check that signs a probe session token and verifies it with the same key.
 */
public class SigningKeyHealthCheck extends HealthCheck {

  static final String PROBE_SUBJECT = "healthcheck@tenantguard";

  private final SessionTokenManager sessionTokenManager;

  /**
   * Instantiates a new signing key health check.
   *
   * @param sessionTokenManager the session token manager
   */
  public SigningKeyHealthCheck(SessionTokenManager sessionTokenManager) {
    this.sessionTokenManager = sessionTokenManager;
  }

  @Override
  protected Result check() {
    String probe = sessionTokenManager.issueToken(PROBE_SUBJECT);
    Optional<String> subject = sessionTokenManager.verify(probe);
    if (subject.isEmpty()) {
      return Result.unhealthy("Probe token failed verification");
    }
    if (!PROBE_SUBJECT.equals(subject.get())) {
      return Result.unhealthy("Probe token verified with unexpected subject");
    }
    return Result.healthy("algorithm=%s", sessionTokenManager.config().algorithm());
  }
}
