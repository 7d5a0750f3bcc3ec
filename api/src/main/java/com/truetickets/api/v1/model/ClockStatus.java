package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableClockStatus.class)
@JsonDeserialize(as = ImmutableClockStatus.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ClockStatus {

  @JsonProperty("clocked_in")
  boolean clockedIn();

}
