package com.truetickets.tickets;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truetickets.tickets.model.AttachmentsConfiguration;
import com.truetickets.tickets.model.DynamoDbConfiguration;
import com.truetickets.tickets.model.ImmutableShopConfiguration;
import com.truetickets.tickets.model.ShopConfiguration;
import com.truetickets.tickets.model.UpstreamConfiguration;
import io.dropwizard.client.JerseyClientConfiguration;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * The tickets server configuration, read from yaml.
 */
public class TicketsServerConfiguration extends Configuration {

  @Valid
  @NotNull
  private DynamoDbConfiguration dynamoDb;

  @Valid
  @NotNull
  private AttachmentsConfiguration attachments;

  @Valid
  @NotNull
  private UpstreamConfiguration upstream;

  @Valid
  @NotNull
  private ShopConfiguration shop = ImmutableShopConfiguration.builder().build();

  @Valid
  @NotNull
  private JerseyClientConfiguration upstreamClient = new JerseyClientConfiguration();

  @JsonProperty("dynamoDb")
  public DynamoDbConfiguration getDynamoDb() {
    return dynamoDb;
  }

  @JsonProperty("dynamoDb")
  public void setDynamoDb(final DynamoDbConfiguration dynamoDb) {
    this.dynamoDb = dynamoDb;
  }

  @JsonProperty("attachments")
  public AttachmentsConfiguration getAttachments() {
    return attachments;
  }

  @JsonProperty("attachments")
  public void setAttachments(final AttachmentsConfiguration attachments) {
    this.attachments = attachments;
  }

  @JsonProperty("upstream")
  public UpstreamConfiguration getUpstream() {
    return upstream;
  }

  @JsonProperty("upstream")
  public void setUpstream(final UpstreamConfiguration upstream) {
    this.upstream = upstream;
  }

  @JsonProperty("shop")
  public ShopConfiguration getShop() {
    return shop;
  }

  @JsonProperty("shop")
  public void setShop(final ShopConfiguration shop) {
    this.shop = shop;
  }

  /**
   * Settings of the http client used for the legacy api.
   *
   * @return the jersey client configuration
   */
  @JsonProperty("upstreamClient")
  public JerseyClientConfiguration getUpstreamClient() {
    return upstreamClient;
  }

  @JsonProperty("upstreamClient")
  public void setUpstreamClient(final JerseyClientConfiguration upstreamClient) {
    this.upstreamClient = upstreamClient;
  }

}
