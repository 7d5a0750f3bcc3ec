package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A ticket as the legacy system returns it from {@code /tickets/{id}}, inside {@code {"ticket": ...}}.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamTicket.class)
@JsonDeserialize(as = ImmutableUpstreamTicket.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamTicket {

  @JsonProperty("number")
  long number();

  @JsonProperty("subject")
  String subject();

  @JsonProperty("status")
  String status();

  /**
   * Created at, RFC 3339.
   *
   * @return the string
   */
  @JsonProperty("created_at")
  String createdAt();

  /**
   * Updated at, RFC 3339.
   *
   * @return the string
   */
  @JsonProperty("updated_at")
  String updatedAt();

  @JsonProperty("customer_id")
  long customerId();

  @JsonProperty("properties")
  Optional<UpstreamProperties> properties();

  @JsonProperty("ticket_type_id")
  Optional<Long> ticketTypeId();

  /**
   * Ticket fields. The type id of the first one wins over the ticket's own.
   *
   * @return the list
   */
  @JsonProperty("ticket_fields")
  List<UpstreamTicketField> ticketFields();

  @JsonProperty("comments")
  List<UpstreamComment> comments();

  @JsonProperty("attachments")
  List<UpstreamAttachment> attachments();

  @JsonProperty("customer")
  UpstreamCustomer customer();

}
