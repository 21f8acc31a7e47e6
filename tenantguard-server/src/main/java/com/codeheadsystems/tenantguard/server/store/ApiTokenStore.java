package com.codeheadsystems.tenantguard.server.store;

import com.codeheadsystems.tenantguard.model.StoredApiToken;
import java.util.List;

/**
 * Read access to API token records needed during authentication.
 * <p>
 * Implementations must be thread-safe.
 */
public interface ApiTokenStore {

  /**
   * Lists every token whose active flag is set, expired or not.
   * <p>
   * Order is defined by the store; callers must not rely on it being sorted.
   *
   * @return the active tokens
   */
  List<StoredApiToken> listActiveTokens();
}
