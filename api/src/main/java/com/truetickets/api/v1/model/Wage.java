package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The hourly wage of a user, in cents.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableWage.class)
@JsonDeserialize(as = ImmutableWage.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Wage {

  @JsonProperty("user_name")
  String userName();

  @JsonProperty("wage_cents")
  long wageCents();

}
