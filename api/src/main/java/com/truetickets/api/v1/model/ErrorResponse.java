package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Error response. Every failed call returns this envelope.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableErrorResponse.class)
@JsonDeserialize(as = ImmutableErrorResponse.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ErrorResponse {

  /**
   * Short title of the error.
   *
   * @return the string
   */
  @JsonProperty("error")
  String error();

  /**
   * Details string.
   *
   * @return the string
   */
  @JsonProperty("details")
  String details();

  /**
   * What the caller could do about it.
   *
   * @return the optional
   */
  @JsonProperty("suggestion")
  Optional<String> suggestion();

}
