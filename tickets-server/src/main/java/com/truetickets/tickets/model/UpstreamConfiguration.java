package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Where legacy tickets are migrated from.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamConfiguration.class)
@JsonDeserialize(as = ImmutableUpstreamConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamConfiguration {

  /**
   * Base url of the upstream api, without a trailing slash.
   *
   * @return the string
   */
  @JsonProperty("baseUrl")
  @Value.Default
  default String baseUrl() {
    return "https://Cacell.repairshopr.com/api/v1";
  }

  /**
   * Api key string, kept out of toString.
   *
   * @return the string
   */
  @JsonProperty("apiKey")
  @Value.Redacted
  String apiKey();

}
