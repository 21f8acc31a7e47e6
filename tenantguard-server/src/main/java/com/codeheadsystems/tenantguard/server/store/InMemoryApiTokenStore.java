package com.codeheadsystems.tenantguard.server.store;

import com.codeheadsystems.tenantguard.model.StoredApiToken;
import com.codeheadsystems.tenantguard.server.exception.EntityNotFoundException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link ApiTokenStore} backed by a {@link ConcurrentSkipListMap}, so active tokens
 * are listed in id order. Suitable for development and tests only.
 */
public class InMemoryApiTokenStore implements ApiTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryApiTokenStore.class);

  private final ConcurrentSkipListMap<Long, StoredApiToken> tokens = new ConcurrentSkipListMap<>();

  public InMemoryApiTokenStore() {
    log.warn("Using InMemoryApiTokenStore - API tokens will NOT survive restarts. "
        + "Replace with a persistent ApiTokenStore for production.");
  }

  /**
   * Stores or replaces a token record.
   *
   * @param token the record
   */
  public void save(StoredApiToken token) {
    tokens.put(token.id(), token);
    log.debug("Stored API token id={} tenant={}", token.id(), token.tenantId());
  }

  /**
   * Looks up a token record by id, active or not.
   *
   * @param id the token id
   * @return the record, or empty
   */
  public Optional<StoredApiToken> findById(long id) {
    return Optional.ofNullable(tokens.get(id));
  }

  /**
   * Removes a token record.
   *
   * @param id the token id
   * @throws EntityNotFoundException if no such token exists
   */
  public void delete(long id) {
    if (tokens.remove(id) == null) {
      throw new EntityNotFoundException("Token", id);
    }
  }

  @Override
  public List<StoredApiToken> listActiveTokens() {
    return tokens.values().stream()
        .filter(StoredApiToken::active)
        .toList();
  }
}
