package com.codeheadsystems.tenantguard.server.token;

import com.codeheadsystems.tenantguard.model.StoredApiToken;
import com.codeheadsystems.tenantguard.server.store.ApiTokenStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identifies the stored API token a presented secret belongs to.
 * <p>
 * Secrets are stored only as bcrypt hashes, so there is no key to look a token up by: every
 * active record is verified in turn, in the order the store returns them, and the first
 * unexpired record whose hash verifies wins. An expired record is skipped even when its hash
 * verifies. The cost of a lookup therefore grows linearly with the number of active tokens.
 * <p>
 * "No such token", "inactive" and "expired" all produce the same empty result.
 */
public class ApiTokenMatcher {

  private static final Logger log = LoggerFactory.getLogger(ApiTokenMatcher.class);

  private final ApiTokenStore apiTokenStore;
  private final ApiTokenHasher hasher;
  private final Clock clock;

  /**
   * Instantiates a new matcher.
   *
   * @param apiTokenStore source of active token records
   * @param hasher        bcrypt verifier
   * @param clock         time source for expiry checks
   */
  public ApiTokenMatcher(ApiTokenStore apiTokenStore, ApiTokenHasher hasher, Clock clock) {
    this.apiTokenStore = apiTokenStore;
    this.hasher = hasher;
    this.clock = clock;
  }

  /**
   * Finds the token matching a presented secret.
   *
   * @param secret the presented secret
   * @return the matching active, unexpired record, or empty
   */
  public Optional<StoredApiToken> match(String secret) {
    if (secret == null || secret.isBlank()) {
      return Optional.empty();
    }
    List<StoredApiToken> candidates = apiTokenStore.listActiveTokens();
    Instant now = clock.instant();
    for (StoredApiToken candidate : candidates) {
      if (!candidate.active() || !hasher.matches(secret, candidate.tokenHash())) {
        continue;
      }
      if (candidate.isExpiredAt(now)) {
        log.debug("API token id={} matched but expired at {}", candidate.id(), candidate.expiresAt());
        continue;
      }
      return Optional.of(candidate);
    }
    log.debug("No active API token matched ({} candidates)", candidates.size());
    return Optional.empty();
  }
}
