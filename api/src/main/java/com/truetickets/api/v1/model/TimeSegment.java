package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A worked segment of a day, epoch seconds.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTimeSegment.class)
@JsonDeserialize(as = ImmutableTimeSegment.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface TimeSegment {

  @JsonProperty("start")
  long start();

  @JsonProperty("end")
  long end();

}
