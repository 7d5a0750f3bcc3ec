package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Identifies the customer that was created or changed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCustomerReference.class)
@JsonDeserialize(as = ImmutableCustomerReference.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CustomerReference {

  /**
   * Of customer reference.
   *
   * @param customerId the customer id
   * @return the customer reference
   */
  static CustomerReference of(final String customerId) {
    return ImmutableCustomerReference.builder().customerId(customerId).build();
  }

  @JsonProperty("customer_id")
  String customerId();

}
