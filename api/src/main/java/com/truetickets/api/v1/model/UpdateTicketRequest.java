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
 * The interface Update ticket request.
 * <p>
 * Only the present fields are changed. An empty password, items left or line items removes that field.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateTicketRequest.class)
@JsonDeserialize(as = ImmutableUpdateTicketRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateTicketRequest {

  @JsonProperty("subject")
  Optional<String> subject();

  @JsonProperty("status")
  Optional<TicketStatus> status();

  @JsonProperty("password")
  Optional<String> password();

  @JsonProperty("items_left")
  Optional<List<String>> itemsLeft();

  @JsonProperty("device")
  Optional<Device> device();

  @JsonProperty("line_items")
  Optional<List<LineItem>> lineItems();

  /**
   * If nothing was asked to change.
   *
   * @return the boolean
   */
  @JsonIgnore
  default boolean isEmpty() {
    return subject().isEmpty() && status().isEmpty() && password().isEmpty()
        && itemsLeft().isEmpty() && device().isEmpty() && lineItems().isEmpty();
  }

}
