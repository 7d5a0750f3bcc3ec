package com.truetickets.tickets.converter;

import static com.truetickets.tickets.converter.AttributeValues.n;
import static com.truetickets.tickets.converter.AttributeValues.s;

import com.truetickets.api.v1.model.Comment;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableComment;
import com.truetickets.api.v1.model.ImmutableLineItem;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.LineItem;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ItemBuilder;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Ticket items and the rows of the subject index.
 */
@Singleton
public class TicketConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TicketConverter.class);

  /**
   * Instantiates a new Ticket converter.
   */
  @Inject
  public TicketConverter() {
    LOGGER.info("TicketConverter()");
  }

  /**
   * The composite the status and device index is keyed on.
   *
   * @param status the status
   * @param device the device
   * @return the string
   */
  public static String statusDevice(final TicketStatus status, final Device device) {
    return status.displayName() + "#" + device.displayName();
  }

  /**
   * To item. Adds the composite status and device, and the constant partition of the ordered indexes.
   *
   * @param ticket the ticket
   * @return the map
   */
  public Map<String, AttributeValue> toItem(final Ticket ticket) {
    return ItemBuilder.item()
        .with(Attributes.TICKET_NUMBER, ticket.ticketNumber())
        .with(Attributes.CUSTOMER_ID, ticket.customerId())
        .with(Attributes.SUBJECT, ticket.subject())
        .with(Attributes.DEVICE, ticket.device().displayName())
        .with(Attributes.STATUS, ticket.status().displayName())
        .with(Attributes.STATUS_DEVICE, statusDevice(ticket.status(), ticket.device()))
        .withIfNotEmpty(Attributes.PASSWORD, ticket.password())
        .withIfNotEmpty(Attributes.ITEMS_LEFT, ticket.itemsLeft().stream().map(AttributeValue::fromS).toList())
        .withIfNotEmpty(Attributes.ATTACHMENTS, ticket.attachments().stream().map(AttributeValue::fromS).toList())
        .withIfNotEmpty(Attributes.COMMENTS, ticket.comments().stream().map(this::comment).toList())
        .withIfNotEmpty(Attributes.LINE_ITEMS, ticket.lineItems().stream().map(this::lineItem).toList())
        .withIfPresent(Attributes.PAID_AT, ticket.paidAt())
        .withIfPresent(Attributes.TOTAL_PAID_CENTS, ticket.totalPaidCents())
        .with(Attributes.CREATED_AT, ticket.createdAt())
        .with(Attributes.LAST_UPDATED, ticket.lastUpdated())
        .with(Attributes.GSI_PK, Attributes.ALL)
        .build();
  }

  /**
   * From item.
   *
   * @param item the item
   * @return the ticket
   */
  public Ticket fromItem(final Map<String, AttributeValue> item) {
    return ImmutableTicket.builder()
        .ticketNumber(AttributeValues.number(item, Attributes.TICKET_NUMBER))
        .customerId(AttributeValues.string(item, Attributes.CUSTOMER_ID))
        .subject(AttributeValues.string(item, Attributes.SUBJECT))
        .device(device(AttributeValues.string(item, Attributes.DEVICE)))
        .status(status(AttributeValues.string(item, Attributes.STATUS)))
        .password(AttributeValues.optionalString(item, Attributes.PASSWORD))
        .itemsLeft(AttributeValues.list(item, Attributes.ITEMS_LEFT, AttributeValues::stringElement))
        .attachments(AttributeValues.list(item, Attributes.ATTACHMENTS, AttributeValues::stringElement))
        .comments(AttributeValues.list(item, Attributes.COMMENTS, this::readComment))
        .lineItems(AttributeValues.list(item, Attributes.LINE_ITEMS, this::readLineItem))
        .paidAt(AttributeValues.optionalNumber(item, Attributes.PAID_AT))
        .totalPaidCents(AttributeValues.optionalNumber(item, Attributes.TOTAL_PAID_CENTS))
        .createdAt(AttributeValues.number(item, Attributes.CREATED_AT))
        .lastUpdated(AttributeValues.number(item, Attributes.LAST_UPDATED))
        .build();
  }

  /**
   * Row of the subject index.
   *
   * @param ticketNumber the ticket number
   * @param subject      the subject, lowered here
   * @return the map
   */
  public Map<String, AttributeValue> subjectItem(final long ticketNumber, final String subject) {
    return ItemBuilder.item()
        .with(Attributes.TICKET_NUMBER, ticketNumber)
        .with(Attributes.SUBJECT_LC, CustomerConverter.lower(subject))
        .with(Attributes.GSI_PK, Attributes.ALL)
        .build();
  }

  /**
   * Comment as a map element.
   *
   * @param comment the comment
   * @return the attribute value
   */
  public AttributeValue comment(final Comment comment) {
    return AttributeValue.fromM(Map.of(
        Attributes.COMMENT_BODY, s(comment.commentBody()),
        Attributes.TECH_NAME, s(comment.techName()),
        Attributes.CREATED_AT, n(comment.createdAt())));
  }

  public Comment readComment(final AttributeValue value) {
    final Map<String, AttributeValue> map = AttributeValues.map(value);
    return ImmutableComment.builder()
        .commentBody(AttributeValues.string(map, Attributes.COMMENT_BODY))
        .techName(AttributeValues.string(map, Attributes.TECH_NAME))
        .createdAt(AttributeValues.number(map, Attributes.CREATED_AT))
        .build();
  }

  /**
   * Line item as a map element.
   *
   * @param lineItem the line item
   * @return the attribute value
   */
  public AttributeValue lineItem(final LineItem lineItem) {
    return AttributeValue.fromM(Map.of(
        Attributes.SUBJECT, s(lineItem.subject()),
        Attributes.PRICE_CENTS, n(lineItem.priceCents())));
  }

  public LineItem readLineItem(final AttributeValue value) {
    final Map<String, AttributeValue> map = AttributeValues.map(value);
    return ImmutableLineItem.builder()
        .subject(AttributeValues.string(map, Attributes.SUBJECT))
        .priceCents(AttributeValues.number(map, Attributes.PRICE_CENTS))
        .build();
  }

  /**
   * The line items attribute, for conditions that compare the whole list.
   *
   * @param lineItems the line items
   * @return the attribute value
   */
  public AttributeValue lineItems(final List<LineItem> lineItems) {
    return AttributeValue.fromL(lineItems.stream().map(this::lineItem).toList());
  }

  /**
   * Device from its stored name.
   *
   * @param value the value
   * @return the device
   */
  public static Device device(final String value) {
    final Optional<Device> device = Device.find(value);
    return device.orElseThrow(() -> new InternalException("Deserialization Error", "Unknown device " + value));
  }

  /**
   * Status from its stored name.
   *
   * @param value the value
   * @return the ticket status
   */
  public static TicketStatus status(final String value) {
    final Optional<TicketStatus> status = TicketStatus.find(value);
    return status.orElseThrow(() -> new InternalException("Deserialization Error", "Unknown status " + value));
  }

}
