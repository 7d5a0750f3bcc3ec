package com.truetickets.server.module;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.health.HealthCheck;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.truetickets.server.resource.ApiGatewayFilter;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.server.resource.JsonProcessingExceptionMapper;
import com.truetickets.server.resource.RequestTraceFilter;
import com.truetickets.server.resource.ServiceExceptionMapper;
import com.truetickets.server.resource.UnexpectedExceptionMapper;
import com.truetickets.server.resource.WebApplicationExceptionMapper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import dagger.multibindings.IntoSet;
import dagger.multibindings.Multibinds;
import io.dropwizard.core.setup.Environment;
import java.util.Set;
import javax.inject.Singleton;

/**
 * Provides the dropwizard pieces to the rest of the component, and the resources every server needs.
 */
@Module(includes = DropWizardModule.Binder.class)
public class DropWizardModule {

  private final Environment environment;

  /**
   * Instantiates a new Drop wizard module.
   *
   * @param environment the environment
   */
  public DropWizardModule(final Environment environment) {
    this.environment = environment;
  }

  /**
   * Environment environment.
   *
   * @return the environment
   */
  @Provides
  @Singleton
  public Environment environment() {
    return environment;
  }

  /**
   * Metric registry.
   *
   * @return the metric registry
   */
  @Provides
  @Singleton
  public MetricRegistry metricRegistry() {
    return environment.metrics();
  }

  /**
   * The object mapper dropwizard configured.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return environment.getObjectMapper();
  }

  /**
   * The interface Binder.
   */
  @Module
  public interface Binder {

    /**
     * Resources set, may be empty.
     *
     * @return the set
     */
    @Multibinds
    Set<JerseyResource> resources();

    /**
     * Health checks set, may be empty.
     *
     * @return the set
     */
    @Multibinds
    Set<HealthCheck> healthChecks();

    @Binds
    @IntoSet
    JerseyResource apiGatewayFilter(ApiGatewayFilter resource);

    @Binds
    @IntoSet
    JerseyResource requestTraceFilter(RequestTraceFilter resource);

    @Binds
    @IntoSet
    JerseyResource serviceExceptionMapper(ServiceExceptionMapper resource);

    @Binds
    @IntoSet
    JerseyResource webApplicationExceptionMapper(WebApplicationExceptionMapper resource);

    @Binds
    @IntoSet
    JerseyResource jsonProcessingExceptionMapper(JsonProcessingExceptionMapper resource);

    @Binds
    @IntoSet
    JerseyResource unexpectedExceptionMapper(UnexpectedExceptionMapper resource);

  }

}
