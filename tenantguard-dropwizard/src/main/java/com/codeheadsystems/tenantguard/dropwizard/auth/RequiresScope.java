package com.codeheadsystems.tenantguard.dropwizard.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the authenticated principal to hold a scope.
 * <p>
 * On a resource class it applies to every method; a method-level annotation takes precedence.
 * The resource must also be authenticated (an {@code @Auth} parameter or {@code @RolesAllowed}).
 *
 * @see ScopeRequirementFeature
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresScope {

  /**
   * The scope name, e.g. {@code health:read}.
   *
   * @return the scope
   */
  String value();
}
