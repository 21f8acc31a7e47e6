package com.codeheadsystems.tenantguard.dropwizard.auth;

import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.DynamicFeature;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.FeatureContext;
import java.lang.reflect.Method;

/**
 * Installs a {@link ScopeRequirementFilter} on every resource method carrying
 * {@link RequiresScope}, directly or through its class.
 */
public class ScopeRequirementFeature implements DynamicFeature {

  @Override
  public void configure(ResourceInfo resourceInfo, FeatureContext context) {
    Method method = resourceInfo.getResourceMethod();
    RequiresScope annotation = method.getAnnotation(RequiresScope.class);
    if (annotation == null) {
      annotation = resourceInfo.getResourceClass().getAnnotation(RequiresScope.class);
    }
    if (annotation != null) {
      context.register(new ScopeRequirementFilter(annotation.value()), Priorities.AUTHORIZATION);
    }
  }
}
