package com.codeheadsystems.tenantguard.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class StoredApiTokenTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private static StoredApiToken token(Instant expiresAt, Long userId) {
    return new StoredApiToken(1, "ci", "$2b$04$hash", "[\"health:read\"]", true, expiresAt, 7, userId);
  }

  @Test
  void isExpiredAt_noExpiry_neverExpires() {
    assertThat(token(null, null).isExpiredAt(NOW)).isFalse();
  }

  @Test
  void isExpiredAt_pastExpiry_isExpired() {
    assertThat(token(NOW.minusSeconds(1), null).isExpiredAt(NOW)).isTrue();
  }

  @Test
  void isExpiredAt_futureExpiry_isNotExpired() {
    assertThat(token(NOW.plusSeconds(60), null).isExpiredAt(NOW)).isFalse();
  }

  @Test
  void isExpiredAt_exactlyNow_isNotExpired() {
    assertThat(token(NOW, null).isExpiredAt(NOW)).isFalse();
  }

  @Test
  void isTenantWide_followsUserId() {
    assertThat(token(null, null).isTenantWide()).isTrue();
    assertThat(token(null, 3L).isTenantWide()).isFalse();
  }

  @Test
  void scopeSet_parsesStoredJson() {
    assertThat(token(null, null).scopeSet()).containsExactly("health:read");
  }
}
