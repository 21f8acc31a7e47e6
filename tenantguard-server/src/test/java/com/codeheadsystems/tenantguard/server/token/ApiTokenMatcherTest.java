package com.codeheadsystems.tenantguard.server.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tenantguard.model.StoredApiToken;
import com.codeheadsystems.tenantguard.server.store.ApiTokenStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApiTokenMatcherTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final ApiTokenHasher HASHER = new ApiTokenHasher(ApiTokenHasher.MIN_COST);

  @Mock private ApiTokenStore apiTokenStore;

  private ApiTokenMatcher matcher;

  @BeforeEach
  void setUp() {
    matcher = new ApiTokenMatcher(apiTokenStore, HASHER, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static StoredApiToken token(long id, String secret, Instant expiresAt) {
    return new StoredApiToken(id, "token-" + id, HASHER.hash(secret), "[\"health:read\"]", true,
        expiresAt, 7, null);
  }

  @Test
  void match_returnsTheRecordWhoseHashVerifies() {
    StoredApiToken first = token(1, "first-secret", null);
    StoredApiToken second = token(2, "second-secret", null);
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(first, second));

    assertThat(matcher.match("second-secret")).contains(second);
  }

  @Test
  void match_secondSecretNeverMatchesFirstHash() {
    StoredApiToken first = token(1, "first-secret", null);
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(first));

    assertThat(matcher.match("second-secret")).isEmpty();
  }

  @Test
  void match_expiredRecord_isSkippedAndScanContinues() {
    StoredApiToken expired = token(1, "shared", NOW.minusSeconds(1));
    StoredApiToken current = token(2, "shared", NOW.plusSeconds(3600));
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(expired, current));

    assertThat(matcher.match("shared")).contains(current);
  }

  @Test
  void match_onlyExpiredRecord_returnsEmpty() {
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(token(1, "abc123", NOW.minusSeconds(60))));

    assertThat(matcher.match("abc123")).isEmpty();
  }

  @Test
  void match_firstVerifyingRecordInStoreOrderWins() {
    StoredApiToken later = token(9, "shared", null);
    StoredApiToken earlier = token(3, "shared", null);
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(later, earlier));

    assertThat(matcher.match("shared")).contains(later);
  }

  @Test
  void match_inactiveRecordReturnedByStore_isIgnored() {
    StoredApiToken inactive = new StoredApiToken(1, "off", HASHER.hash("abc123"), "[]", false,
        null, 7, null);
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(inactive));

    assertThat(matcher.match("abc123")).isEmpty();
  }

  @Test
  void match_malformedStoredHash_isSkipped() {
    StoredApiToken broken = new StoredApiToken(1, "broken", "plaintext", "[]", true, null, 7, null);
    StoredApiToken good = token(2, "abc123", null);
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of(broken, good));

    assertThat(matcher.match("abc123")).contains(good);
  }

  @Test
  void match_blankSecret_doesNotTouchStore() {
    assertThat(matcher.match(" ")).isEmpty();
    assertThat(matcher.match(null)).isEmpty();
    verify(apiTokenStore, never()).listActiveTokens();
  }

  @Test
  void match_noTokens_returnsEmpty() {
    when(apiTokenStore.listActiveTokens()).thenReturn(List.of());

    assertThat(matcher.match("whatever")).isEmpty();
  }
}
