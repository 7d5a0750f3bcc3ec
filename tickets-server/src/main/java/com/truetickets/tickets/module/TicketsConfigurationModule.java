package com.truetickets.tickets.module;

import com.truetickets.tickets.TicketsServerConfiguration;
import com.truetickets.tickets.model.AttachmentsConfiguration;
import com.truetickets.tickets.model.DynamoDbConfiguration;
import com.truetickets.tickets.model.ShopConfiguration;
import com.truetickets.tickets.model.UpstreamConfiguration;
import dagger.Module;
import dagger.Provides;
import io.dropwizard.client.JerseyClientConfiguration;
import javax.inject.Singleton;

/**
 * Provides the configuration read from yaml, and its parts.
 */
@Module
public class TicketsConfigurationModule {

  private final TicketsServerConfiguration configuration;

  /**
   * Instantiates a new Tickets configuration module.
   *
   * @param configuration the configuration
   */
  public TicketsConfigurationModule(final TicketsServerConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration tickets server configuration.
   *
   * @return the tickets server configuration
   */
  @Provides
  @Singleton
  public TicketsServerConfiguration configuration() {
    return configuration;
  }

  @Provides
  @Singleton
  public DynamoDbConfiguration dynamoDbConfiguration() {
    return configuration.getDynamoDb();
  }

  @Provides
  @Singleton
  public AttachmentsConfiguration attachmentsConfiguration() {
    return configuration.getAttachments();
  }

  @Provides
  @Singleton
  public UpstreamConfiguration upstreamConfiguration() {
    return configuration.getUpstream();
  }

  @Provides
  @Singleton
  public ShopConfiguration shopConfiguration() {
    return configuration.getShop();
  }

  /**
   * Upstream client configuration.
   *
   * @return the jersey client configuration
   */
  @Provides
  @Singleton
  public JerseyClientConfiguration upstreamClientConfiguration() {
    return configuration.getUpstreamClient();
  }

}
