package com.truetickets.server;

import com.codahale.metrics.health.HealthCheck;
import com.truetickets.server.component.DropWizardComponent;
import com.truetickets.server.module.DropWizardModule;
import com.truetickets.server.resource.JerseyResource;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.Configuration;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of our dropwizard servers. The dagger component built by the implementation provides everything that is
 * registered with jersey and the health checks.
 *
 * @param <T> the configuration type.
 */
public abstract class Server<T extends Configuration> extends Application<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Server.class);

  /**
   * Implement this to build the dagger component from the dropwizard module and your configuration.
   *
   * @param configuration the configuration read from yaml.
   * @param module        the module holding the dropwizard environment.
   * @return the component.
   */
  protected abstract DropWizardComponent dropWizardComponent(final T configuration,
                                                             final DropWizardModule module);

  /**
   * Allows environment variables to be referenced from the configuration file.
   *
   * @param bootstrap the bootstrap
   */
  @Override
  public void initialize(final Bootstrap<T> bootstrap) {
    LOGGER.info("initialize({})", bootstrap);
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)));
  }

  /**
   * Builds the component and registers what it provides.
   *
   * @param configuration the configuration
   * @param environment   the environment
   */
  @Override
  public void run(final T configuration,
                  final Environment environment) {
    LOGGER.info("run({})", configuration);
    final DropWizardComponent component = dropWizardComponent(configuration, new DropWizardModule(environment));
    for (JerseyResource resource : component.resources()) {
      LOGGER.info("Registering resource: {}", resource.getClass().getSimpleName());
      environment.jersey().register(resource);
    }
    for (HealthCheck healthCheck : component.healthChecks()) {
      LOGGER.info("Registering health check: {}", healthCheck.getClass().getName());
      environment.healthChecks().register(healthCheck.getClass().getName(), healthCheck);
    }
  }

}
