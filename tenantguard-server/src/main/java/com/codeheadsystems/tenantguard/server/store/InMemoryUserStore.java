package com.codeheadsystems.tenantguard.server.store;

import com.codeheadsystems.tenantguard.model.StoredUser;
import com.codeheadsystems.tenantguard.server.exception.EntityNotFoundException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link UserStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Emails are matched exactly, as stored. Suitable for development and tests only.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<Long, StoredUser> usersById = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Long> idsByEmail = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore - users will NOT survive restarts. "
        + "Replace with a persistent UserStore for production.");
  }

  /**
   * Stores or replaces a user.
   *
   * @param user the user
   */
  public synchronized void save(StoredUser user) {
    StoredUser previous = usersById.put(user.id(), user);
    if (previous != null) {
      idsByEmail.remove(previous.email());
    }
    idsByEmail.put(user.email(), user.id());
    log.debug("Stored user id={}", user.id());
  }

  /**
   * Removes a user.
   *
   * @param id the user id
   * @throws EntityNotFoundException if no such user exists
   */
  public synchronized void delete(long id) {
    StoredUser removed = usersById.remove(id);
    if (removed == null) {
      throw new EntityNotFoundException("User", id);
    }
    idsByEmail.remove(removed.email());
  }

  @Override
  public Optional<StoredUser> findByEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(idsByEmail.get(email)).map(usersById::get);
  }

  @Override
  public Optional<StoredUser> findById(long id) {
    return Optional.ofNullable(usersById.get(id));
  }
}
