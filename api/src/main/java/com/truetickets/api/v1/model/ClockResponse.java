package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Result of a clock in or clock out.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableClockResponse.class)
@JsonDeserialize(as = ImmutableClockResponse.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ClockResponse {

  @JsonProperty("message")
  String message();

  @JsonProperty("clocked_in")
  boolean clockedIn();

  @JsonProperty("timestamp")
  long timestamp();

}
