package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Store config.
 * <p>
 * Shop wide settings. The tax rate is read on every payment so changes apply at once.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStoreConfig.class)
@JsonDeserialize(as = ImmutableStoreConfig.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface StoreConfig {

  /**
   * Store name string.
   *
   * @return the string
   */
  @JsonProperty("store_name")
  String storeName();

  /**
   * Tax rate in percent, like 8.25.
   *
   * @return the double
   */
  @JsonProperty("tax_rate")
  double taxRate();

  @JsonProperty("address")
  Optional<String> address();

  @JsonProperty("city")
  Optional<String> city();

  @JsonProperty("state")
  Optional<String> state();

  @JsonProperty("zip")
  Optional<String> zip();

  @JsonProperty("phone")
  Optional<String> phone();

  @JsonProperty("email")
  Optional<String> email();

  /**
   * Disclaimer printed on receipts and intake forms.
   *
   * @return the optional
   */
  @JsonProperty("disclaimer")
  Optional<String> disclaimer();

}
