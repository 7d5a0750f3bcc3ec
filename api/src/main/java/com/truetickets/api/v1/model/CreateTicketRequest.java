package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Create ticket request.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCreateTicketRequest.class)
@JsonDeserialize(as = ImmutableCreateTicketRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CreateTicketRequest {

  /**
   * Customer id of an existing customer.
   *
   * @return the string
   */
  @JsonProperty("customer_id")
  String customerId();

  /**
   * Subject string.
   *
   * @return the string
   */
  @JsonProperty("subject")
  String subject();

  /**
   * Password optional.
   *
   * @return the optional
   */
  @JsonProperty("password")
  Optional<String> password();

  /**
   * Items left list.
   *
   * @return the list
   */
  @JsonProperty("items_left")
  List<String> itemsLeft();

  /**
   * Device device.
   *
   * @return the device
   */
  @JsonProperty("device")
  Device device();

}
