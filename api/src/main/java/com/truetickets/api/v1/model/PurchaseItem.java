package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutablePurchaseItem.class)
@JsonDeserialize(as = ImmutablePurchaseItem.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PurchaseItem {

  @JsonProperty("name")
  String name();

  @JsonProperty("amount_cents")
  long amountCents();

}
