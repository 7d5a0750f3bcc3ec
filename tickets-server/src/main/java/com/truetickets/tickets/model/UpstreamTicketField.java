package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamTicketField.class)
@JsonDeserialize(as = ImmutableUpstreamTicketField.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamTicketField {

  @JsonProperty("ticket_type_id")
  Optional<Long> ticketTypeId();

}
