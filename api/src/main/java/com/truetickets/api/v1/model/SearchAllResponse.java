package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Result of searching tickets and customers with the same query.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSearchAllResponse.class)
@JsonDeserialize(as = ImmutableSearchAllResponse.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface SearchAllResponse {

  @JsonProperty("tickets")
  List<Ticket> tickets();

  @JsonProperty("customers")
  List<Customer> customers();

}
