package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A clock in or clock out event of a user.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTimeEntry.class)
@JsonDeserialize(as = ImmutableTimeEntry.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface TimeEntry {

  @JsonProperty("user_name")
  String userName();

  /**
   * When it happened, epoch seconds. Unique across all entries.
   *
   * @return the long
   */
  @JsonProperty("timestamp")
  long timestamp();

  @JsonProperty("is_clock_out")
  boolean isClockOut();

}
