package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Shop configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableShopConfiguration.class)
@JsonDeserialize(as = ImmutableShopConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ShopConfiguration {

  /**
   * Zone the months of the revenue report start and end in.
   *
   * @return the string
   */
  @JsonProperty("timeZone")
  @Value.Default
  default String timeZone() {
    return "UTC";
  }

}
