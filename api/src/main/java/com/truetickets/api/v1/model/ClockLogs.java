package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Clock logs for a time range, with the wages of every user that shows up in them.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableClockLogs.class)
@JsonDeserialize(as = ImmutableClockLogs.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ClockLogs {

  @JsonProperty("clock_logs")
  List<TimeEntry> clockLogs();

  @JsonProperty("wages")
  List<Wage> wages();

}
