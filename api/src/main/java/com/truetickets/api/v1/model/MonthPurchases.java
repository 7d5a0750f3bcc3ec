package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * The purchases ledger for one month.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMonthPurchases.class)
@JsonDeserialize(as = ImmutableMonthPurchases.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface MonthPurchases {

  /**
   * Month in the form YYYY-MM.
   *
   * @return the string
   */
  @JsonProperty("month_year")
  String monthYear();

  @JsonProperty("items")
  List<PurchaseItem> items();

}
