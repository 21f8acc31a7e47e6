package com.codeheadsystems.tenantguard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire view of a resolved principal, for "who am I" style endpoints.
 *
 * @param kind     identity kind name
 * @param id       user id, null for synthetic principals
 * @param email    email or placeholder
 * @param role     role name
 * @param tenantId tenant id, null for global users
 * @param scopes   granted scopes, null when the principal is not scope-restricted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrincipalResponse(@JsonProperty("kind") String kind,
                                @JsonProperty("id") Long id,
                                @JsonProperty("email") String email,
                                @JsonProperty("role") String role,
                                @JsonProperty("tenantId") Long tenantId,
                                @JsonProperty("scopes") List<String> scopes) {

  public PrincipalResponse(TenantPrincipal principal) {
    this(principal.kind().name(),
        principal.id().orElse(null),
        principal.email(),
        principal.role().name(),
        principal.tenantId().orElse(null),
        principal.grantedScopes().map(s -> s.stream().sorted().toList()).orElse(null));
  }
}
