package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * The full list of purchases for a month, replacing whatever was there.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdatePurchasesRequest.class)
@JsonDeserialize(as = ImmutableUpdatePurchasesRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdatePurchasesRequest {

  @JsonProperty("items")
  List<PurchaseItem> items();

}
