package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Create customer request.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCreateCustomerRequest.class)
@JsonDeserialize(as = ImmutableCreateCustomerRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CreateCustomerRequest {

  @JsonProperty("full_name")
  String fullName();

  @JsonProperty("email")
  Optional<String> email();

  /**
   * Phone numbers, at least one is required.
   *
   * @return the list
   */
  @JsonProperty("phone_numbers")
  List<PhoneNumber> phoneNumbers();

}
