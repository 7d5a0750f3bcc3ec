package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Replaces all the clock entries of a user within one day with the given segments.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateClockLogsRequest.class)
@JsonDeserialize(as = ImmutableUpdateClockLogsRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateClockLogsRequest {

  /**
   * User whose entries are replaced.
   *
   * @return the string
   */
  @JsonProperty("user_name")
  String userName();

  /**
   * Start of the day, epoch seconds, inclusive.
   *
   * @return the long
   */
  @JsonProperty("start_of_day")
  long startOfDay();

  /**
   * End of the day, epoch seconds, inclusive.
   *
   * @return the long
   */
  @JsonProperty("end_of_day")
  long endOfDay();

  /**
   * Segments list. Empty clears the day.
   *
   * @return the list
   */
  @JsonProperty("segments")
  List<TimeSegment> segments();

}
