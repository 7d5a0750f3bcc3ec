package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Dynamo db configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDynamoDbConfiguration.class)
@JsonDeserialize(as = ImmutableDynamoDbConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface DynamoDbConfiguration {

  /**
   * Region string.
   *
   * @return the string
   */
  @JsonProperty("region")
  String region();

  /**
   * Endpoint override, for local stores.
   *
   * @return the optional
   */
  @JsonProperty("endpoint")
  Optional<String> endpoint();

}
