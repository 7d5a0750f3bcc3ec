package com.truetickets.tickets.manager;

import static com.truetickets.tickets.converter.AttributeValues.n;
import static com.truetickets.tickets.converter.AttributeValues.s;

import com.truetickets.api.v1.model.Comment;
import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.api.v1.model.UpdateCustomerRequest;
import com.truetickets.api.v1.model.UpdateTicketRequest;
import com.truetickets.tickets.converter.CustomerConverter;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import com.truetickets.tickets.dao.TransactItems;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Builds the writes that keep the derived tables in step with customers and tickets. Each method returns the whole
 * write set of one mutation, primary item included, to be committed as one transaction. Nothing here talks to the
 * store.
 */
@Singleton
public class IndexManager {

  /**
   * Position of the customer check in a ticket create.
   */
  public static final int TICKET_CREATE_CUSTOMER_CHECK = 0;
  /**
   * Position of the ticket put in a ticket create.
   */
  public static final int TICKET_CREATE_TICKET_PUT = 1;

  private static final Logger LOGGER = LoggerFactory.getLogger(IndexManager.class);

  private final CustomerConverter customerConverter;
  private final TicketConverter ticketConverter;

  /**
   * Instantiates a new Index manager.
   *
   * @param customerConverter the customer converter
   * @param ticketConverter   the ticket converter
   */
  @Inject
  public IndexManager(final CustomerConverter customerConverter,
                      final TicketConverter ticketConverter) {
    LOGGER.info("IndexManager({},{})", customerConverter, ticketConverter);
    this.customerConverter = customerConverter;
    this.ticketConverter = ticketConverter;
  }

  /**
   * A new customer, its name row and a row per phone. The customer put fails if the id is taken.
   *
   * @param customer the customer
   * @return the list
   */
  public List<TransactWriteItem> customerCreate(final Customer customer) {
    LOGGER.trace("customerCreate({})", customer.customerId());
    final List<TransactWriteItem> items = new ArrayList<>();
    final ExpressionBuilder condition = new ExpressionBuilder();
    items.add(TransactItems.put(TableNames.CUSTOMERS, customerConverter.toItem(customer), condition,
        "attribute_not_exists(" + condition.name(Attributes.CUSTOMER_ID) + ")"));
    items.add(TransactItems.put(TableNames.CUSTOMER_NAMES,
        customerConverter.nameItem(customer.customerId(), customer.fullName())));
    for (String number : numbers(customer.phoneNumbers())) {
      items.add(TransactItems.put(TableNames.CUSTOMER_PHONE_INDEX,
          customerConverter.phoneKey(number, customer.customerId())));
    }
    return items;
  }

  /**
   * Changes to an existing customer. When the phones change, the rows of numbers that left are deleted and rows for
   * numbers that joined are put, and the customer update only applies if its phones are still the ones read.
   *
   * @param customerId    the customer id
   * @param currentPhones the phones read, consistently, before the change
   * @param request       the request
   * @param now           the now
   * @return the list
   */
  public List<TransactWriteItem> customerUpdate(final String customerId,
                                                final List<PhoneNumber> currentPhones,
                                                final UpdateCustomerRequest request,
                                                final long now) {
    LOGGER.trace("customerUpdate({})", customerId);
    final List<TransactWriteItem> items = new ArrayList<>();
    final ExpressionBuilder update = new ExpressionBuilder();
    final Optional<String> fullName = request.fullName().map(String::trim);
    fullName.ifPresent(name -> update.set(Attributes.FULL_NAME, s(name)));
    request.email().map(String::trim).ifPresent(email -> {
      if (email.isEmpty()) {
        update.remove(Attributes.EMAIL);
      } else {
        update.set(Attributes.EMAIL, s(email));
      }
    });
    String condition = "attribute_exists(" + update.name(Attributes.CUSTOMER_ID) + ")";
    if (request.phoneNumbers().isPresent()) {
      update.set(Attributes.PHONE_NUMBERS, customerConverter.phoneNumbers(request.phoneNumbers().get()));
      condition = condition + " AND " + update.name(Attributes.PHONE_NUMBERS) + " = "
          + update.value(customerConverter.phoneNumbers(currentPhones));
    }
    update.set(Attributes.LAST_UPDATED, n(now));
    items.add(TransactItems.update(TableNames.CUSTOMERS, ItemBuilder.key(Attributes.CUSTOMER_ID, customerId),
        update, condition));

    fullName.ifPresent(name -> {
      final ExpressionBuilder nameUpdate = new ExpressionBuilder()
          .set(Attributes.FULL_NAME_LC, s(CustomerConverter.lower(name)));
      items.add(TransactItems.update(TableNames.CUSTOMER_NAMES,
          ItemBuilder.key(Attributes.CUSTOMER_ID, customerId), nameUpdate, null));
    });
    request.phoneNumbers().ifPresent(phones -> items.addAll(phoneDiff(customerId, currentPhones, phones)));
    return items;
  }

  /**
   * Writes a customer as it is, replacing what is stored, and moves its phone rows from the previous phones.
   *
   * @param customer       the customer
   * @param previousPhones the phones stored before, empty for a new customer
   * @return the list
   */
  public List<TransactWriteItem> customerUpsert(final Customer customer, final List<PhoneNumber> previousPhones) {
    LOGGER.trace("customerUpsert({})", customer.customerId());
    final List<TransactWriteItem> items = new ArrayList<>();
    items.add(TransactItems.put(TableNames.CUSTOMERS, customerConverter.toItem(customer)));
    items.add(TransactItems.put(TableNames.CUSTOMER_NAMES,
        customerConverter.nameItem(customer.customerId(), customer.fullName())));
    final Set<String> current = numbers(customer.phoneNumbers());
    for (String number : numbers(previousPhones)) {
      if (!current.contains(number)) {
        items.add(TransactItems.delete(TableNames.CUSTOMER_PHONE_INDEX,
            customerConverter.phoneKey(number, customer.customerId())));
      }
    }
    for (String number : current) {
      items.add(TransactItems.put(TableNames.CUSTOMER_PHONE_INDEX,
          customerConverter.phoneKey(number, customer.customerId())));
    }
    return items;
  }

  /**
   * A new ticket and its subject row. The first member checks the customer exists, the second fails if the number
   * is taken, see {@link #TICKET_CREATE_CUSTOMER_CHECK} and {@link #TICKET_CREATE_TICKET_PUT}.
   *
   * @param ticket the ticket
   * @return the list
   */
  public List<TransactWriteItem> ticketCreate(final Ticket ticket) {
    LOGGER.trace("ticketCreate({})", ticket.ticketNumber());
    final ExpressionBuilder customerCheck = new ExpressionBuilder();
    final ExpressionBuilder ticketCondition = new ExpressionBuilder();
    return List.of(
        TransactItems.conditionCheck(TableNames.CUSTOMERS,
            ItemBuilder.key(Attributes.CUSTOMER_ID, ticket.customerId()), customerCheck,
            "attribute_exists(" + customerCheck.name(Attributes.CUSTOMER_ID) + ")"),
        TransactItems.put(TableNames.TICKETS, ticketConverter.toItem(ticket), ticketCondition,
            "attribute_not_exists(" + ticketCondition.name(Attributes.TICKET_NUMBER) + ")"),
        TransactItems.put(TableNames.TICKET_SUBJECTS,
            ticketConverter.subjectItem(ticket.ticketNumber(), ticket.subject())));
  }

  /**
   * Writes a ticket as it is, replacing what is stored, with its subject row.
   *
   * @param ticket the ticket
   * @return the list
   */
  public List<TransactWriteItem> ticketUpsert(final Ticket ticket) {
    LOGGER.trace("ticketUpsert({})", ticket.ticketNumber());
    return List.of(
        TransactItems.put(TableNames.TICKETS, ticketConverter.toItem(ticket)),
        TransactItems.put(TableNames.TICKET_SUBJECTS,
            ticketConverter.subjectItem(ticket.ticketNumber(), ticket.subject())));
  }

  /**
   * Changes to an existing ticket. Only the fields in the request are written, empty password, items left and line
   * items are removed. The composite status and device is rewritten when either part changes, and the write only
   * applies if status and device are still the ones read.
   *
   * @param ticketNumber  the ticket number
   * @param currentStatus the status read before the change
   * @param currentDevice the device read before the change
   * @param request       the request
   * @param now           the now
   * @return the list
   */
  public List<TransactWriteItem> ticketUpdate(final long ticketNumber,
                                              final TicketStatus currentStatus,
                                              final Device currentDevice,
                                              final UpdateTicketRequest request,
                                              final long now) {
    LOGGER.trace("ticketUpdate({})", ticketNumber);
    final List<TransactWriteItem> items = new ArrayList<>();
    final ExpressionBuilder update = new ExpressionBuilder();
    final Optional<String> subject = request.subject().map(String::trim);
    subject.ifPresent(value -> update.set(Attributes.SUBJECT, s(value)));
    request.status().ifPresent(status -> update.set(Attributes.STATUS, s(status.displayName())));
    request.device().ifPresent(device -> update.set(Attributes.DEVICE, s(device.displayName())));
    if (request.status().isPresent() || request.device().isPresent()) {
      update.set(Attributes.STATUS_DEVICE, s(TicketConverter.statusDevice(
          request.status().orElse(currentStatus), request.device().orElse(currentDevice))));
    }
    request.password().ifPresent(password -> {
      if (password.isEmpty()) {
        update.remove(Attributes.PASSWORD);
      } else {
        update.set(Attributes.PASSWORD, s(password));
      }
    });
    request.itemsLeft().ifPresent(itemsLeft -> {
      if (itemsLeft.isEmpty()) {
        update.remove(Attributes.ITEMS_LEFT);
      } else {
        update.set(Attributes.ITEMS_LEFT, AttributeValue.fromL(itemsLeft.stream().map(AttributeValue::fromS).toList()));
      }
    });
    request.lineItems().ifPresent(lineItems -> {
      if (lineItems.isEmpty()) {
        update.remove(Attributes.LINE_ITEMS);
      } else {
        update.set(Attributes.LINE_ITEMS, ticketConverter.lineItems(lineItems));
      }
    });
    update.set(Attributes.LAST_UPDATED, n(now));
    final String condition = String.format("%s = %s AND %s = %s",
        update.name(Attributes.STATUS), update.value(s(currentStatus.displayName())),
        update.name(Attributes.DEVICE), update.value(s(currentDevice.displayName())));
    items.add(TransactItems.update(TableNames.TICKETS, ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber),
        update, condition));

    subject.ifPresent(value -> items.add(TransactItems.put(TableNames.TICKET_SUBJECTS,
        ticketConverter.subjectItem(ticketNumber, value))));
    return items;
  }

  /**
   * Appends a comment to an existing ticket. A single item write, no index changes.
   *
   * @param ticketNumber the ticket number
   * @param comment      the comment
   * @param now          the now
   * @return the update item request
   */
  public UpdateItemRequest commentAppend(final long ticketNumber, final Comment comment, final long now) {
    LOGGER.trace("commentAppend({})", ticketNumber);
    final ExpressionBuilder update = new ExpressionBuilder()
        .append(Attributes.COMMENTS, List.of(ticketConverter.comment(comment)))
        .set(Attributes.LAST_UPDATED, n(now));
    return UpdateItemRequest.builder()
        .tableName(TableNames.TICKETS)
        .key(ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber))
        .updateExpression(update.updateExpression())
        .conditionExpression("attribute_exists(" + update.name(Attributes.TICKET_NUMBER) + ")")
        .expressionAttributeNames(update.names())
        .expressionAttributeValues(update.values())
        .build();
  }

  private List<TransactWriteItem> phoneDiff(final String customerId,
                                            final List<PhoneNumber> before,
                                            final List<PhoneNumber> after) {
    final Set<String> previous = numbers(before);
    final Set<String> current = numbers(after);
    final List<TransactWriteItem> items = new ArrayList<>();
    for (String number : previous) {
      if (!current.contains(number)) {
        items.add(TransactItems.delete(TableNames.CUSTOMER_PHONE_INDEX, customerConverter.phoneKey(number, customerId)));
      }
    }
    for (String number : current) {
      if (!previous.contains(number)) {
        items.add(TransactItems.put(TableNames.CUSTOMER_PHONE_INDEX, customerConverter.phoneKey(number, customerId)));
      }
    }
    return items;
  }

  private Set<String> numbers(final List<PhoneNumber> phoneNumbers) {
    final Set<String> numbers = new LinkedHashSet<>();
    phoneNumbers.forEach(phoneNumber -> numbers.add(phoneNumber.number()));
    return numbers;
  }

}
