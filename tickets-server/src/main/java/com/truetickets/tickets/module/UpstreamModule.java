package com.truetickets.tickets.module;

import com.truetickets.tickets.migration.RepairShoprClient;
import dagger.Module;
import dagger.Provides;
import io.dropwizard.client.JerseyClientBuilder;
import io.dropwizard.client.JerseyClientConfiguration;
import io.dropwizard.core.setup.Environment;
import jakarta.ws.rs.client.Client;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The http client for the legacy api.
 */
@Module
public class UpstreamModule {

  /**
   * Upstream client. Dropwizard manages its lifecycle and metrics.
   *
   * @param environment   the environment
   * @param configuration the configuration
   * @return the client
   */
  @Provides
  @Singleton
  @Named(RepairShoprClient.UPSTREAM_CLIENT)
  public Client upstreamClient(final Environment environment,
                               final JerseyClientConfiguration configuration) {
    return new JerseyClientBuilder(environment)
        .using(configuration)
        .build(RepairShoprClient.UPSTREAM_CLIENT);
  }

}
