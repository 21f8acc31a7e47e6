package com.codeheadsystems.tenantguard.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RoleTest {

  @Test
  void isApiTier_excludesOnlyUser() {
    assertThat(Role.SUPER_ADMIN.isApiTier()).isTrue();
    assertThat(Role.TENANT_ADMIN.isApiTier()).isTrue();
    assertThat(Role.API_USER.isApiTier()).isTrue();
    assertThat(Role.USER.isApiTier()).isFalse();
  }

  @Test
  void fromName_isCaseInsensitive() {
    assertThat(Role.fromName(" tenant_admin ")).isEqualTo(Role.TENANT_ADMIN);
  }

  @Test
  void fromName_unknown_throwsIAE() {
    assertThatThrownBy(() -> Role.fromName("ROOT"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown role");
  }

  @Test
  void fromName_null_throwsIAE() {
    assertThatThrownBy(() -> Role.fromName(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
