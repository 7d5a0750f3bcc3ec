package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Update customer request. An empty email removes it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateCustomerRequest.class)
@JsonDeserialize(as = ImmutableUpdateCustomerRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateCustomerRequest {

  @JsonProperty("full_name")
  Optional<String> fullName();

  @JsonProperty("email")
  Optional<String> email();

  @JsonProperty("phone_numbers")
  Optional<List<PhoneNumber>> phoneNumbers();

  /**
   * If nothing was asked to change.
   *
   * @return the boolean
   */
  @JsonIgnore
  default boolean isEmpty() {
    return fullName().isEmpty() && email().isEmpty() && phoneNumbers().isEmpty();
  }

}
