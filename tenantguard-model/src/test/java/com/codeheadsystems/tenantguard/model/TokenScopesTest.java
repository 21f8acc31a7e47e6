package com.codeheadsystems.tenantguard.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenScopesTest {

  @Test
  void parse_array_keepsStoredOrder() {
    assertThat(TokenScopes.parse("[\"status:read\", \"health:read\"]"))
        .containsExactly("status:read", "health:read");
  }

  @Test
  void parse_duplicates_collapsed() {
    assertThat(TokenScopes.parse("[\"health:read\",\"health:read\"]")).containsExactly("health:read");
  }

  @Test
  void parse_emptyArray_returnsEmptySet() {
    assertThat(TokenScopes.parse("[]")).isEmpty();
  }

  @Test
  void parse_result_isUnmodifiable() {
    assertThatThrownBy(() -> TokenScopes.parse("[\"a\"]").add("b"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void parse_blank_throwsIAE() {
    assertThatThrownBy(() -> TokenScopes.parse("  "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing scopes");
  }

  @Test
  void parse_notJson_throwsIAE() {
    assertThatThrownBy(() -> TokenScopes.parse("health:read"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid scopes JSON");
  }

  @Test
  void parse_object_throwsIAE() {
    assertThatThrownBy(() -> TokenScopes.parse("{\"scope\":\"health:read\"}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_nullLiteral_throwsIAE() {
    assertThatThrownBy(() -> TokenScopes.parse("null"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_blankEntry_throwsIAE() {
    assertThatThrownBy(() -> TokenScopes.parse("[\"health:read\", \" \"]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Blank scope");
  }

  @Test
  void serialize_writesJsonArray() {
    assertThat(TokenScopes.serialize(List.of("health:read", "status:read")))
        .isEqualTo("[\"health:read\",\"status:read\"]");
  }
}
