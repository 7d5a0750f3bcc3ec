package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A billable line on a ticket.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLineItem.class)
@JsonDeserialize(as = ImmutableLineItem.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface LineItem {

  @JsonProperty("subject")
  String subject();

  /**
   * Price in cents.
   *
   * @return the long
   */
  @JsonProperty("price_cents")
  long priceCents();

}
