package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The customer embedded in a legacy ticket.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamCustomer.class)
@JsonDeserialize(as = ImmutableUpstreamCustomer.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamCustomer {

  @JsonProperty("business_and_full_name")
  String businessAndFullName();

  @JsonProperty("email")
  Optional<String> email();

  @JsonProperty("phone")
  Optional<String> phone();

  @JsonProperty("mobile")
  Optional<String> mobile();

  /**
   * Created at, RFC 3339.
   *
   * @return the string
   */
  @JsonProperty("created_at")
  String createdAt();

  @JsonProperty("updated_at")
  Optional<String> updatedAt();

}
