package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Customer.
 * <p>
 * Timestamps are optional since some lookups only project the identity and phone numbers.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCustomer.class)
@JsonDeserialize(as = ImmutableCustomer.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface Customer {

  /**
   * Customer id, a 10 character base36 string for customers created here.
   *
   * @return the string
   */
  @JsonProperty("customer_id")
  String customerId();

  /**
   * Full name for display.
   *
   * @return the string
   */
  @JsonProperty("full_name")
  String fullName();

  /**
   * Email optional.
   *
   * @return the optional
   */
  @JsonProperty("email")
  Optional<String> email();

  /**
   * Phone numbers, in the order the customer gave them.
   *
   * @return the list
   */
  @JsonProperty("phone_numbers")
  List<PhoneNumber> phoneNumbers();

  /**
   * Created at, epoch seconds.
   *
   * @return the optional
   */
  @JsonProperty("created_at")
  Optional<Long> createdAt();

  /**
   * Last updated, epoch seconds.
   *
   * @return the optional
   */
  @JsonProperty("last_updated")
  Optional<Long> lastUpdated();

}
