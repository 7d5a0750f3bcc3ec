package com.truetickets.server.component;

import com.codahale.metrics.health.HealthCheck;
import com.truetickets.server.resource.JerseyResource;
import java.util.Set;

/**
 * What a server component has to provide. Extend this with your own dagger component.
 */
public interface DropWizardComponent {

  /**
   * Everything to register with jersey: resources, filters and exception mappers.
   *
   * @return the set
   */
  Set<JerseyResource> resources();

  /**
   * Health checks set.
   *
   * @return the set
   */
  Set<HealthCheck> healthChecks();

}
