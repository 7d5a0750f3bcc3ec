package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Identifies the ticket that was created or changed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTicketReference.class)
@JsonDeserialize(as = ImmutableTicketReference.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface TicketReference {

  /**
   * Of ticket reference.
   *
   * @param ticketNumber the ticket number
   * @return the ticket reference
   */
  static TicketReference of(final long ticketNumber) {
    return ImmutableTicketReference.builder().ticketNumber(ticketNumber).build();
  }

  @JsonProperty("ticket_number")
  long ticketNumber();

}
