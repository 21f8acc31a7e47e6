package com.codeheadsystems.tenantguard.server.store;

import com.codeheadsystems.tenantguard.model.StoredUser;
import java.util.Optional;

/**
 * Read access to user rows needed during authentication.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back this with the
 * relational user table.
 */
public interface UserStore {

  /**
   * Looks up a user by login email.
   *
   * @param email the email, as carried in a session token subject
   * @return the user, or empty if none exists
   */
  Optional<StoredUser> findByEmail(String email);

  /**
   * Looks up a user by primary key.
   *
   * @param id the user id
   * @return the user, or empty if none exists
   */
  Optional<StoredUser> findById(long id);
}
