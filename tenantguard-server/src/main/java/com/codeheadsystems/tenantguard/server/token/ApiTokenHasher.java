package com.codeheadsystems.tenantguard.server.token;

import java.security.SecureRandom;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-way hashing of API token secrets with bcrypt.
 * <p>
 * Hashes are written in the {@code $2b$} form; verification also accepts {@code $2a$} and
 * {@code $2y$} hashes produced by other bcrypt implementations. The cost is embedded in each hash,
 * so changing {@link #cost()} only affects newly hashed secrets.
 */
public class ApiTokenHasher {

  private static final Logger log = LoggerFactory.getLogger(ApiTokenHasher.class);

  public static final int DEFAULT_COST = 12;
  public static final int MIN_COST = 4;
  public static final int MAX_COST = 31;

  private static final String VERSION = "2b";
  private static final int SALT_BYTES = 16;

  private final SecureRandom random;
  private final int cost;

  public ApiTokenHasher() {
    this(DEFAULT_COST);
  }

  /**
   * Instantiates a hasher with the given bcrypt cost.
   *
   * @param cost log2 of the bcrypt iteration count, between {@value #MIN_COST} and
   *             {@value #MAX_COST}
   */
  public ApiTokenHasher(int cost) {
    this(cost, new SecureRandom());
  }

  ApiTokenHasher(int cost, SecureRandom random) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST);
    }
    this.cost = cost;
    this.random = random;
  }

  /**
   * Hashes a secret with a fresh random salt.
   *
   * @param secret the plaintext secret
   * @return the 60-character bcrypt string
   */
  public String hash(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Missing secret");
    }
    byte[] salt = new byte[SALT_BYTES];
    random.nextBytes(salt);
    return OpenBSDBCrypt.generate(VERSION, secret.toCharArray(), salt, cost);
  }

  /**
   * Checks a presented secret against a stored hash.
   * <p>
   * A stored value that is not a well-formed bcrypt string never matches.
   *
   * @param secret     the presented secret
   * @param storedHash the stored bcrypt string
   * @return true if the secret produced the hash
   */
  public boolean matches(String secret, String storedHash) {
    if (secret == null || secret.isEmpty() || storedHash == null) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(storedHash, secret.toCharArray());
    } catch (IllegalArgumentException | DataLengthException e) {
      log.debug("Stored token hash is not a valid bcrypt string: {}", e.getMessage());
      return false;
    }
  }

  public int cost() {
    return cost;
  }
}
