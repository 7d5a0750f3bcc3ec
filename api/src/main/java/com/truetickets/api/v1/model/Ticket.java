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
 * The interface Ticket.
 * <p>
 * A repair ticket. The customer is only present when the ticket was joined with its customer on read.
 * The paid at and total paid values are present together, and only while the ticket is resolved by payment.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTicket.class)
@JsonDeserialize(as = ImmutableTicket.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface Ticket {

  /**
   * Ticket number, assigned once and never reused.
   *
   * @return the long
   */
  @JsonProperty("ticket_number")
  long ticketNumber();

  /**
   * Customer id.
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
   * Device device.
   *
   * @return the device
   */
  @JsonProperty("device")
  Device device();

  /**
   * Status ticket status.
   *
   * @return the ticket status
   */
  @JsonProperty("status")
  TicketStatus status();

  /**
   * Password of the device, if the customer left one.
   *
   * @return the optional
   */
  @JsonProperty("password")
  Optional<String> password();

  /**
   * Items left with the device, like chargers.
   *
   * @return the list
   */
  @JsonProperty("items_left")
  List<String> itemsLeft();

  /**
   * Attachment urls.
   *
   * @return the list
   */
  @JsonProperty("attachments")
  List<String> attachments();

  /**
   * Comments, oldest first.
   *
   * @return the list
   */
  @JsonProperty("comments")
  List<Comment> comments();

  /**
   * Line items.
   *
   * @return the list
   */
  @JsonProperty("line_items")
  List<LineItem> lineItems();

  /**
   * Paid at, epoch seconds.
   *
   * @return the optional
   */
  @JsonProperty("paid_at")
  Optional<Long> paidAt();

  /**
   * Total paid cents, tax included.
   *
   * @return the optional
   */
  @JsonProperty("total_paid_cents")
  Optional<Long> totalPaidCents();

  /**
   * Created at, epoch seconds.
   *
   * @return the long
   */
  @JsonProperty("created_at")
  long createdAt();

  /**
   * Last updated, epoch seconds.
   *
   * @return the long
   */
  @JsonProperty("last_updated")
  long lastUpdated();

  /**
   * The customer of the ticket, when joined.
   *
   * @return the optional
   */
  @JsonProperty("customer")
  Optional<Customer> customer();

}
