package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.Comment;
import com.truetickets.api.v1.model.CommentRequest;
import com.truetickets.api.v1.model.CreateTicketRequest;
import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableComment;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.api.v1.model.UpdateTicketRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.StoreConflictException;
import com.truetickets.tickets.dao.TableNames;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;

/**
 * Tickets, their lookups and their changes short of payment.
 */
@Singleton
public class TicketManager {

  /**
   * Most tickets the recent listings return.
   */
  public static final int RECENT_LIMIT = 30;
  /**
   * Most tickets a suffix lookup returns.
   */
  public static final int SUFFIX_LIMIT = 7;

  private static final Logger LOGGER = LoggerFactory.getLogger(TicketManager.class);
  private static final Comparator<Ticket> NEWEST_FIRST = Comparator.comparingLong(Ticket::ticketNumber).reversed();

  private final DynamoDbStore dynamoDbStore;
  private final IndexManager indexManager;
  private final IdentifierManager identifierManager;
  private final CustomerManager customerManager;
  private final TicketConverter ticketConverter;
  private final Clock clock;

  /**
   * Instantiates a new Ticket manager.
   *
   * @param dynamoDbStore     the dynamo db store
   * @param indexManager      the index manager
   * @param identifierManager the identifier manager
   * @param customerManager   the customer manager
   * @param ticketConverter   the ticket converter
   * @param clock             the clock
   */
  @Inject
  public TicketManager(final DynamoDbStore dynamoDbStore,
                       final IndexManager indexManager,
                       final IdentifierManager identifierManager,
                       final CustomerManager customerManager,
                       final TicketConverter ticketConverter,
                       final Clock clock) {
    LOGGER.info("TicketManager({},{},{},{})", dynamoDbStore, indexManager, identifierManager, customerManager);
    this.dynamoDbStore = dynamoDbStore;
    this.indexManager = indexManager;
    this.identifierManager = identifierManager;
    this.customerManager = customerManager;
    this.ticketConverter = ticketConverter;
    this.clock = clock;
  }

  /**
   * The ticket with its customer.
   *
   * @param ticketNumber the ticket number
   * @return the ticket
   */
  public Ticket get(final long ticketNumber) {
    LOGGER.trace("get({})", ticketNumber);
    final Ticket ticket = dynamoDbStore.get(TableNames.TICKETS, key(ticketNumber), false)
        .map(ticketConverter::fromItem)
        .orElseThrow(() -> notFound(ticketNumber));
    return customerManager.withCustomers(List.of(ticket)).get(0);
  }

  /**
   * Tickets whose number ends in the digits, newest first. Looks back from the latest number a thousand at a time.
   *
   * @param suffix the last three digits, 0 to 999
   * @return the list
   */
  public List<Ticket> bySuffix(final int suffix) {
    LOGGER.trace("bySuffix({})", suffix);
    if (suffix < 0 || suffix > 999) {
      throw new BadInputException("Invalid Parameter", "The last 3 digits must be between 0 and 999.");
    }
    final long counter = identifierManager.currentTicketNumber();
    long candidate = counter / 1000 * 1000 + suffix;
    if (candidate > counter) {
      candidate -= 1000;
    }
    final List<Map<String, AttributeValue>> keys = new ArrayList<>();
    for (; candidate >= 1 && keys.size() < SUFFIX_LIMIT; candidate -= 1000) {
      keys.add(key(candidate));
    }
    if (keys.isEmpty()) {
      return List.of();
    }
    final List<Ticket> tickets = dynamoDbStore.batchGet(TableNames.TICKETS, keys).stream()
        .map(ticketConverter::fromItem)
        .sorted(NEWEST_FIRST)
        .toList();
    return customerManager.withCustomers(tickets);
  }

  /**
   * Tickets whose subject contains every word of the query, newest first, at most
   * {@link SearchTerms#MAX_RESULTS}.
   *
   * @param query the query
   * @return the list
   */
  public List<Ticket> bySubject(final String query) {
    LOGGER.trace("bySubject({})", query);
    final List<String> words = SearchTerms.tokenize(query);
    if (words.isEmpty()) {
      return List.of();
    }
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final String filter = SearchTerms.containsAll(expressions, Attributes.SUBJECT_LC, words);
    final QueryRequest request = QueryRequest.builder()
        .tableName(TableNames.TICKET_SUBJECTS)
        .indexName(TableNames.TICKET_NUMBER_INDEX)
        .keyConditionExpression(expressions.name(Attributes.GSI_PK) + " = "
            + expressions.value(AttributeValues.s(Attributes.ALL)))
        .filterExpression(filter)
        .projectionExpression(expressions.projection(Attributes.TICKET_NUMBER))
        .scanIndexForward(false)
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    final List<Long> numbers = dynamoDbStore.query(request, SearchTerms.MAX_RESULTS).stream()
        .map(item -> AttributeValues.number(item, Attributes.TICKET_NUMBER))
        .toList();
    return customerManager.withCustomers(fetchInOrder(numbers));
  }

  /**
   * Every ticket of the customer, newest first, each with the customer.
   *
   * @param customerId the customer id
   * @return the list
   */
  public List<Ticket> byCustomer(final String customerId) {
    LOGGER.trace("byCustomer({})", customerId);
    final Customer customer = customerManager.get(customerId);
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final QueryRequest request = QueryRequest.builder()
        .tableName(TableNames.TICKETS)
        .indexName(TableNames.CUSTOMER_ID_INDEX)
        .keyConditionExpression(expressions.name(Attributes.CUSTOMER_ID) + " = "
            + expressions.value(AttributeValues.s(customerId)))
        .scanIndexForward(false)
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    return dynamoDbStore.query(request, Integer.MAX_VALUE).stream()
        .map(ticketConverter::fromItem)
        .sorted(NEWEST_FIRST)
        .map(ticket -> (Ticket) ImmutableTicket.copyOf(ticket).withCustomer(customer))
        .toList();
  }

  /**
   * The newest tickets, optionally only those of the device and statuses. A missing device means every device, no
   * statuses means every status.
   *
   * @param device   the device
   * @param statuses the statuses
   * @return the list
   */
  public List<Ticket> recent(final Optional<Device> device, final List<TicketStatus> statuses) {
    LOGGER.trace("recent({},{})", device, statuses);
    if (device.isEmpty() && statuses.isEmpty()) {
      final ExpressionBuilder expressions = new ExpressionBuilder();
      final QueryRequest request = QueryRequest.builder()
          .tableName(TableNames.TICKETS)
          .indexName(TableNames.TICKET_NUMBER_INDEX)
          .keyConditionExpression(expressions.name(Attributes.GSI_PK) + " = "
              + expressions.value(AttributeValues.s(Attributes.ALL)))
          .scanIndexForward(false)
          .limit(RECENT_LIMIT)
          .expressionAttributeNames(expressions.names())
          .expressionAttributeValues(expressions.values())
          .build();
      return customerManager.withCustomers(dynamoDbStore.query(request, RECENT_LIMIT).stream()
          .map(ticketConverter::fromItem)
          .toList());
    }
    final List<Device> devices = device.map(d -> List.of(d)).orElseGet(() -> Arrays.asList(Device.values()));
    final List<TicketStatus> wanted = statuses.isEmpty() ? Arrays.asList(TicketStatus.values()) : statuses;
    final Map<Long, Ticket> merged = new HashMap<>();
    for (Device d : devices) {
      for (TicketStatus status : wanted) {
        final ExpressionBuilder expressions = new ExpressionBuilder();
        final QueryRequest request = QueryRequest.builder()
            .tableName(TableNames.TICKETS)
            .indexName(TableNames.STATUS_DEVICE_INDEX)
            .keyConditionExpression(expressions.name(Attributes.STATUS_DEVICE) + " = "
                + expressions.value(AttributeValues.s(TicketConverter.statusDevice(status, d))))
            .scanIndexForward(false)
            .limit(RECENT_LIMIT)
            .expressionAttributeNames(expressions.names())
            .expressionAttributeValues(expressions.values())
            .build();
        dynamoDbStore.query(request, RECENT_LIMIT).stream()
            .map(ticketConverter::fromItem)
            .forEach(ticket -> merged.put(ticket.ticketNumber(), ticket));
      }
    }
    return customerManager.withCustomers(merged.values().stream()
        .sorted(NEWEST_FIRST)
        .limit(RECENT_LIMIT)
        .toList());
  }

  /**
   * Create a ticket for an existing customer. New tickets start out diagnosing.
   *
   * @param request the request
   * @return the ticket number
   */
  public long create(final CreateTicketRequest request) {
    LOGGER.trace("create({})", request.customerId());
    if (request.customerId().isBlank()) {
      throw new BadInputException("Missing Field", "customer_id is required.");
    }
    validateSubject(request.subject());
    final long now = clock.instant().getEpochSecond();
    final Ticket ticket = ImmutableTicket.builder()
        .ticketNumber(identifierManager.nextTicketNumber())
        .customerId(request.customerId())
        .subject(request.subject().trim())
        .device(request.device())
        .status(TicketStatus.DIAGNOSING)
        .password(request.password().filter(password -> !password.isEmpty()))
        .itemsLeft(request.itemsLeft())
        .createdAt(now)
        .lastUpdated(now)
        .build();
    try {
      dynamoDbStore.transactWrite(indexManager.ticketCreate(ticket));
    } catch (StoreConflictException e) {
      if (e.failedAt(IndexManager.TICKET_CREATE_CUSTOMER_CHECK)) {
        throw new NotFoundException("Customer Not Found", "No customer with id " + request.customerId() + ".");
      }
      throw e;
    }
    LOGGER.debug("create() -> {}", ticket.ticketNumber());
    return ticket.ticketNumber();
  }

  /**
   * Update the ticket. At least one field is required. The status can not be moved to or from resolved here, that
   * is what payments and refunds do, and the line items of a resolved ticket are fixed until it is refunded.
   *
   * @param ticketNumber the ticket number
   * @param request      the request
   */
  public void update(final long ticketNumber, final UpdateTicketRequest request) {
    LOGGER.trace("update({})", ticketNumber);
    if (request.isEmpty()) {
      throw new BadInputException("No Changes", "At least one field to update is required.");
    }
    request.subject().ifPresent(this::validateSubject);
    if (request.status().filter(TicketStatus.RESOLVED::equals).isPresent()) {
      throw new BadInputException("Invalid Status", "Use Take Payment or Refund");
    }
    final Map<String, AttributeValue> current = dynamoDbStore.get(TableNames.TICKETS, key(ticketNumber), true,
            Attributes.STATUS, Attributes.DEVICE)
        .orElseThrow(() -> notFound(ticketNumber));
    final TicketStatus currentStatus = TicketConverter.status(AttributeValues.string(current, Attributes.STATUS));
    final Device currentDevice = TicketConverter.device(AttributeValues.string(current, Attributes.DEVICE));
    if (currentStatus == TicketStatus.RESOLVED && request.status().isPresent()) {
      throw new BadInputException("Invalid Status", "Use Take Payment or Refund");
    }
    if (currentStatus == TicketStatus.RESOLVED && request.lineItems().isPresent()) {
      throw new BadInputException("Invalid Status", "The line items of a paid ticket can not change.",
          "Refund the payment first.");
    }
    dynamoDbStore.transactWrite(indexManager.ticketUpdate(ticketNumber, currentStatus, currentDevice, request,
        clock.instant().getEpochSecond()));
  }

  /**
   * Append a comment.
   *
   * @param ticketNumber the ticket number
   * @param request      the request
   */
  public void addComment(final long ticketNumber, final CommentRequest request) {
    LOGGER.trace("addComment({})", ticketNumber);
    if (request.commentBody().isBlank()) {
      throw new BadInputException("Missing Field", "comment_body can not be empty.");
    }
    if (request.techName().isBlank()) {
      throw new BadInputException("Missing Field", "tech_name can not be empty.");
    }
    final long now = clock.instant().getEpochSecond();
    final Comment comment = ImmutableComment.builder()
        .commentBody(request.commentBody())
        .techName(request.techName())
        .createdAt(now)
        .build();
    try {
      dynamoDbStore.update(indexManager.commentAppend(ticketNumber, comment, now));
    } catch (StoreConflictException e) {
      throw notFound(ticketNumber);
    }
  }

  /**
   * When the ticket last changed.
   *
   * @param ticketNumber the ticket number
   * @return the long
   */
  public long lastUpdated(final long ticketNumber) {
    LOGGER.trace("lastUpdated({})", ticketNumber);
    return dynamoDbStore.get(TableNames.TICKETS, key(ticketNumber), true, Attributes.LAST_UPDATED)
        .map(item -> AttributeValues.number(item, Attributes.LAST_UPDATED))
        .orElseThrow(() -> notFound(ticketNumber));
  }

  /**
   * The tickets, in the order of the numbers. Numbers without a ticket are dropped.
   *
   * @param numbers the numbers
   * @return the list
   */
  public List<Ticket> fetchInOrder(final List<Long> numbers) {
    if (numbers.isEmpty()) {
      return List.of();
    }
    final Map<Long, Ticket> found = new HashMap<>();
    dynamoDbStore.batchGet(TableNames.TICKETS, numbers.stream().map(this::key).toList()).stream()
        .map(ticketConverter::fromItem)
        .forEach(ticket -> found.put(ticket.ticketNumber(), ticket));
    final List<Ticket> ordered = numbers.stream()
        .distinct()
        .map(found::get)
        .filter(Objects::nonNull)
        .toList();
    if (ordered.size() < numbers.size()) {
      LOGGER.warn("fetchInOrder(): {} of {} indexed tickets are missing", numbers.size() - ordered.size(),
          numbers.size());
    }
    return ordered;
  }

  private void validateSubject(final String subject) {
    if (subject == null || subject.isBlank()) {
      throw new BadInputException("Missing Field", "The subject can not be empty.");
    }
  }

  private Map<String, AttributeValue> key(final long ticketNumber) {
    return ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber);
  }

  private NotFoundException notFound(final long ticketNumber) {
    return new NotFoundException("Ticket Not Found", "No ticket with number " + ticketNumber + ".");
  }

}
