package com.truetickets.tickets.manager;

import static com.truetickets.tickets.converter.AttributeValues.n;
import static com.truetickets.tickets.converter.AttributeValues.s;

import com.truetickets.api.v1.model.Comment;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableComment;
import com.truetickets.api.v1.model.LineItem;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.ConflictException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Payments, refunds and declined repairs. Each is one conditional write of the ticket that moves its status, keeps
 * the composite status and device in step, and appends a receipt comment. The conditions make sure the ticket still
 * looks like what the receipt was written from.
 */
@Singleton
public class PaymentManager {

  /**
   * Suffix of the tech name on receipts.
   */
  public static final String SYSTEM_SUFFIX = " (System)";

  private static final Logger LOGGER = LoggerFactory.getLogger(PaymentManager.class);

  private final DynamoDbStore dynamoDbStore;
  private final StoreConfigManager storeConfigManager;
  private final TicketConverter ticketConverter;
  private final Clock clock;

  /**
   * Instantiates a new Payment manager.
   *
   * @param dynamoDbStore      the dynamo db store
   * @param storeConfigManager the store config manager
   * @param ticketConverter    the ticket converter
   * @param clock              the clock
   */
  @Inject
  public PaymentManager(final DynamoDbStore dynamoDbStore,
                        final StoreConfigManager storeConfigManager,
                        final TicketConverter ticketConverter,
                        final Clock clock) {
    LOGGER.info("PaymentManager({},{})", dynamoDbStore, storeConfigManager);
    this.dynamoDbStore = dynamoDbStore;
    this.storeConfigManager = storeConfigManager;
    this.ticketConverter = ticketConverter;
    this.clock = clock;
  }

  /**
   * Total with tax, rounded to the cent.
   *
   * @param subtotalCents the subtotal cents
   * @param taxRate       the tax rate in percent
   * @return the long
   */
  public static long totalWithTax(final long subtotalCents, final double taxRate) {
    return Math.round(subtotalCents * (1 + taxRate / 100.0));
  }

  /**
   * Receipt comment body: a header line, a line per item and the total.
   *
   * @param header     the header
   * @param lineItems  the line items
   * @param totalCents the total cents
   * @return the string
   */
  public static String receipt(final String header, final List<LineItem> lineItems, final long totalCents) {
    final StringBuilder builder = new StringBuilder(header);
    for (LineItem lineItem : lineItems) {
      builder.append("\n- ").append(lineItem.subject()).append(": $").append(dollars(lineItem.priceCents()));
    }
    return builder.append("\nTotal: $").append(dollars(totalCents)).toString();
  }

  private static String dollars(final long cents) {
    return BigDecimal.valueOf(cents, 2).toPlainString();
  }

  /**
   * Take payment for the line items plus tax and resolve the ticket.
   *
   * @param ticketNumber the ticket number
   * @param techName     the tech name
   * @return the total paid cents
   */
  public long takePayment(final long ticketNumber, final String techName) {
    LOGGER.trace("takePayment({},{})", ticketNumber, techName);
    final TicketState ticket = read(ticketNumber);
    if (ticket.status == TicketStatus.RESOLVED) {
      throw new ConflictException("Conflict", "Ticket " + ticketNumber + " is already resolved.");
    }
    final long subtotal = ticket.lineItems.stream().mapToLong(LineItem::priceCents).sum();
    final double taxRate = storeConfigManager.taxRate();
    final long total = totalWithTax(subtotal, taxRate);
    final long now = clock.instant().getEpochSecond();

    final ExpressionBuilder update = new ExpressionBuilder()
        .set(Attributes.STATUS, s(TicketStatus.RESOLVED.displayName()))
        .set(Attributes.STATUS_DEVICE, s(TicketConverter.statusDevice(TicketStatus.RESOLVED, ticket.device)))
        .set(Attributes.PAID_AT, n(now))
        .set(Attributes.TOTAL_PAID_CENTS, n(total))
        .set(Attributes.LAST_UPDATED, n(now))
        .append(Attributes.COMMENTS, List.of(receiptComment("[Payment Taken]", ticket.lineItems, total, techName, now)));
    final String condition = String.format("%s <> %s AND %s",
        update.name(Attributes.STATUS), update.value(s(TicketStatus.RESOLVED.displayName())),
        unchanged(update, ticket));
    dynamoDbStore.update(request(ticketNumber, update, condition));
    LOGGER.info("takePayment({}): {} cents at {}% tax", ticketNumber, total, taxRate);
    return total;
  }

  /**
   * Refund the payment and reopen the ticket.
   *
   * @param ticketNumber the ticket number
   * @param techName     the tech name
   */
  public void refundPayment(final long ticketNumber, final String techName) {
    LOGGER.trace("refundPayment({},{})", ticketNumber, techName);
    final TicketState ticket = read(ticketNumber);
    if (ticket.status != TicketStatus.RESOLVED) {
      throw new BadInputException("Bad Request", "Ticket must be Resolved to refund");
    }
    final long now = clock.instant().getEpochSecond();
    final Comment comment = ImmutableComment.builder()
        .commentBody("[Payment Refunded]")
        .techName(techName + SYSTEM_SUFFIX)
        .createdAt(now)
        .build();
    final ExpressionBuilder update = new ExpressionBuilder()
        .set(Attributes.STATUS, s(TicketStatus.IN_PROGRESS.displayName()))
        .set(Attributes.STATUS_DEVICE, s(TicketConverter.statusDevice(TicketStatus.IN_PROGRESS, ticket.device)))
        .set(Attributes.LAST_UPDATED, n(now))
        .append(Attributes.COMMENTS, List.of(ticketConverter.comment(comment)))
        .remove(Attributes.PAID_AT)
        .remove(Attributes.TOTAL_PAID_CENTS);
    final String condition = String.format("%s = %s AND %s = %s",
        update.name(Attributes.STATUS), update.value(s(TicketStatus.RESOLVED.displayName())),
        update.name(Attributes.DEVICE), update.value(s(ticket.device.displayName())));
    dynamoDbStore.update(request(ticketNumber, update, condition));
    LOGGER.info("refundPayment({})", ticketNumber);
  }

  /**
   * The customer declined the repair. The line items move into a zero total receipt and the ticket is ready to be
   * picked up.
   *
   * @param ticketNumber the ticket number
   * @param techName     the tech name
   */
  public void declineRepair(final long ticketNumber, final String techName) {
    LOGGER.trace("declineRepair({},{})", ticketNumber, techName);
    final TicketState ticket = read(ticketNumber);
    if (ticket.status == TicketStatus.RESOLVED) {
      throw new BadInputException("Bad Request", "A resolved ticket can not be declined, refund it first.");
    }
    if (ticket.lineItems.isEmpty()) {
      throw new BadInputException("Bad Request", "The ticket has no line items.");
    }
    final long now = clock.instant().getEpochSecond();
    final ExpressionBuilder update = new ExpressionBuilder()
        .set(Attributes.STATUS, s(TicketStatus.READY.displayName()))
        .set(Attributes.STATUS_DEVICE, s(TicketConverter.statusDevice(TicketStatus.READY, ticket.device)))
        .set(Attributes.LAST_UPDATED, n(now))
        .append(Attributes.COMMENTS, List.of(receiptComment("[Don't fix]", ticket.lineItems, 0, techName, now)))
        .remove(Attributes.LINE_ITEMS);
    final String condition = String.format("%s <> %s AND %s",
        update.name(Attributes.STATUS), update.value(s(TicketStatus.RESOLVED.displayName())),
        unchanged(update, ticket));
    dynamoDbStore.update(request(ticketNumber, update, condition));
  }

  private AttributeValue receiptComment(final String header,
                                        final List<LineItem> lineItems,
                                        final long totalCents,
                                        final String techName,
                                        final long now) {
    return ticketConverter.comment(ImmutableComment.builder()
        .commentBody(receipt(header, lineItems, totalCents))
        .techName(techName + SYSTEM_SUFFIX)
        .createdAt(now)
        .build());
  }

  private String unchanged(final ExpressionBuilder update, final TicketState ticket) {
    final String device = String.format("%s = %s",
        update.name(Attributes.DEVICE), update.value(s(ticket.device.displayName())));
    final String lineItems = ticket.lineItems.isEmpty()
        ? "attribute_not_exists(" + update.name(Attributes.LINE_ITEMS) + ")"
        : update.name(Attributes.LINE_ITEMS) + " = " + update.value(ticketConverter.lineItems(ticket.lineItems));
    return device + " AND " + lineItems;
  }

  private UpdateItemRequest request(final long ticketNumber, final ExpressionBuilder update, final String condition) {
    return UpdateItemRequest.builder()
        .tableName(TableNames.TICKETS)
        .key(ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber))
        .updateExpression(update.updateExpression())
        .conditionExpression(condition)
        .expressionAttributeNames(update.names())
        .expressionAttributeValues(update.values())
        .build();
  }

  private TicketState read(final long ticketNumber) {
    final Map<String, AttributeValue> item = dynamoDbStore.get(TableNames.TICKETS,
            ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber), true,
            Attributes.LINE_ITEMS, Attributes.DEVICE, Attributes.STATUS)
        .orElseThrow(() -> new NotFoundException("Ticket Not Found", "No ticket with number " + ticketNumber + "."));
    return new TicketState(
        TicketConverter.status(AttributeValues.string(item, Attributes.STATUS)),
        TicketConverter.device(AttributeValues.string(item, Attributes.DEVICE)),
        AttributeValues.list(item, Attributes.LINE_ITEMS, ticketConverter::readLineItem));
  }

  /**
   * What a payment is computed from.
   */
  private static class TicketState {

    private final TicketStatus status;
    private final Device device;
    private final List<LineItem> lineItems;

    private TicketState(final TicketStatus status, final Device device, final List<LineItem> lineItems) {
      this.status = status;
      this.device = device;
      this.lineItems = lineItems;
    }

  }

}
