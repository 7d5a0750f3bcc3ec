package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.CreateCustomerRequest;
import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.ImmutableCustomer;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.UpdateCustomerRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.InternalException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.CustomerConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

/**
 * Customers and their phone and name lookups.
 */
@Singleton
public class CustomerManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(CustomerManager.class);

  private static final String[] JOIN_PROJECTION = {
      Attributes.CUSTOMER_ID, Attributes.FULL_NAME, Attributes.EMAIL, Attributes.PHONE_NUMBERS,
      Attributes.CREATED_AT, Attributes.LAST_UPDATED};
  private static final String[] PHONE_PROJECTION = {
      Attributes.CUSTOMER_ID, Attributes.FULL_NAME, Attributes.PHONE_NUMBERS};

  private final DynamoDbStore dynamoDbStore;
  private final IndexManager indexManager;
  private final IdentifierManager identifierManager;
  private final CustomerConverter customerConverter;
  private final Clock clock;

  /**
   * Instantiates a new Customer manager.
   *
   * @param dynamoDbStore     the dynamo db store
   * @param indexManager      the index manager
   * @param identifierManager the identifier manager
   * @param customerConverter the customer converter
   * @param clock             the clock
   */
  @Inject
  public CustomerManager(final DynamoDbStore dynamoDbStore,
                         final IndexManager indexManager,
                         final IdentifierManager identifierManager,
                         final CustomerConverter customerConverter,
                         final Clock clock) {
    LOGGER.info("CustomerManager({},{},{})", dynamoDbStore, indexManager, identifierManager);
    this.dynamoDbStore = dynamoDbStore;
    this.indexManager = indexManager;
    this.identifierManager = identifierManager;
    this.customerConverter = customerConverter;
    this.clock = clock;
  }

  /**
   * Get the customer.
   *
   * @param customerId the customer id
   * @return the customer
   */
  public Customer get(final String customerId) {
    LOGGER.trace("get({})", customerId);
    return dynamoDbStore.get(TableNames.CUSTOMERS, key(customerId), false)
        .map(customerConverter::fromItem)
        .orElseThrow(() -> notFound(customerId));
  }

  /**
   * Customers having the phone number, exactly as stored.
   *
   * @param phoneNumber the phone number
   * @return the list
   */
  public List<Customer> findByPhone(final String phoneNumber) {
    LOGGER.trace("findByPhone({})", phoneNumber);
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final QueryRequest request = QueryRequest.builder()
        .tableName(TableNames.CUSTOMER_PHONE_INDEX)
        .keyConditionExpression(expressions.name(Attributes.PHONE_NUMBER) + " = "
            + expressions.value(AttributeValues.s(phoneNumber)))
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    final List<String> customerIds = dynamoDbStore.query(request, Integer.MAX_VALUE).stream()
        .map(item -> AttributeValues.string(item, Attributes.CUSTOMER_ID))
        .toList();
    return fetch(customerIds, PHONE_PROJECTION);
  }

  /**
   * Customers whose name contains every word of the query, at most {@link SearchTerms#MAX_RESULTS}.
   *
   * @param query the query
   * @return the list
   */
  public List<Customer> searchByName(final String query) {
    LOGGER.trace("searchByName({})", query);
    final List<String> words = SearchTerms.tokenize(query);
    if (words.isEmpty()) {
      return List.of();
    }
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final String filter = SearchTerms.containsAll(expressions, Attributes.FULL_NAME_LC, words);
    final ScanRequest request = ScanRequest.builder()
        .tableName(TableNames.CUSTOMER_NAMES)
        .filterExpression(filter)
        .projectionExpression(expressions.projection(Attributes.CUSTOMER_ID))
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    final List<String> customerIds = dynamoDbStore.scan(request, SearchTerms.MAX_RESULTS).stream()
        .map(item -> AttributeValues.string(item, Attributes.CUSTOMER_ID))
        .toList();
    return fetch(customerIds);
  }

  /**
   * Create a customer with a new id. A taken id surfaces as a conflict, and the caller may try again.
   *
   * @param request the request
   * @return the customer id
   */
  public String create(final CreateCustomerRequest request) {
    LOGGER.trace("create({})", request.fullName());
    validateName(request.fullName());
    if (request.phoneNumbers().isEmpty()) {
      throw new BadInputException("Invalid Phone Numbers", "At least one phone number is required.");
    }
    validatePhones(request.phoneNumbers());
    final long now = clock.instant().getEpochSecond();
    final Customer customer = ImmutableCustomer.builder()
        .customerId(identifierManager.shortId(IdentifierManager.CUSTOMER_ID_LENGTH))
        .fullName(request.fullName().trim())
        .email(request.email().map(String::trim).filter(email -> !email.isEmpty()))
        .phoneNumbers(request.phoneNumbers())
        .createdAt(now)
        .lastUpdated(now)
        .build();
    dynamoDbStore.transactWrite(indexManager.customerCreate(customer));
    LOGGER.debug("create() -> {}", customer.customerId());
    return customer.customerId();
  }

  /**
   * Update the customer. At least one field is required.
   *
   * @param customerId the customer id
   * @param request    the request
   */
  public void update(final String customerId, final UpdateCustomerRequest request) {
    LOGGER.trace("update({})", customerId);
    if (request.isEmpty()) {
      throw new BadInputException("No Changes", "At least one field to update is required.");
    }
    request.fullName().ifPresent(this::validateName);
    request.phoneNumbers().ifPresent(phones -> {
      if (phones.isEmpty()) {
        throw new BadInputException("Invalid Phone Numbers", "At least one phone number is required.");
      }
      validatePhones(phones);
    });
    final List<PhoneNumber> currentPhones = phoneNumbers(customerId)
        .orElseThrow(() -> notFound(customerId));
    dynamoDbStore.transactWrite(indexManager.customerUpdate(customerId, currentPhones, request,
        clock.instant().getEpochSecond()));
  }

  /**
   * The phones of the customer, read consistently, if the customer exists.
   *
   * @param customerId the customer id
   * @return the optional
   */
  public Optional<List<PhoneNumber>> phoneNumbers(final String customerId) {
    return dynamoDbStore.get(TableNames.CUSTOMERS, key(customerId), true,
            Attributes.CUSTOMER_ID, Attributes.PHONE_NUMBERS)
        .map(item -> AttributeValues.list(item, Attributes.PHONE_NUMBERS, customerConverter::readPhoneNumber));
  }

  /**
   * When the customer last changed.
   *
   * @param customerId the customer id
   * @return the long
   */
  public long lastUpdated(final String customerId) {
    LOGGER.trace("lastUpdated({})", customerId);
    return dynamoDbStore.get(TableNames.CUSTOMERS, key(customerId), true, Attributes.LAST_UPDATED)
        .map(item -> AttributeValues.number(item, Attributes.LAST_UPDATED))
        .orElseThrow(() -> notFound(customerId));
  }

  /**
   * Attaches its customer to every ticket, in the order given. Every ticket must point at a customer that exists.
   *
   * @param tickets the tickets
   * @return the list
   */
  public List<Ticket> withCustomers(final List<Ticket> tickets) {
    LOGGER.trace("withCustomers({})", tickets.size());
    if (tickets.isEmpty()) {
      return List.of();
    }
    final Set<String> customerIds = new LinkedHashSet<>();
    tickets.stream()
        .map(Ticket::customerId)
        .filter(id -> !id.isEmpty())
        .forEach(customerIds::add);
    if (customerIds.isEmpty()) {
      LOGGER.error("withCustomers(): {} tickets without a customer id", tickets.size());
      throw new InternalException("Data Integrity Error", "Tickets were found without a customer id.");
    }
    final Map<String, Customer> customers = new HashMap<>();
    fetch(List.copyOf(customerIds), JOIN_PROJECTION).forEach(c -> customers.put(c.customerId(), c));
    return tickets.stream()
        .map(ticket -> {
          final Customer customer = customers.get(ticket.customerId());
          if (customer == null) {
            LOGGER.error("withCustomers(): ticket {} points at missing customer {}",
                ticket.ticketNumber(), ticket.customerId());
            throw new InternalException("Data Integrity Error",
                "Ticket " + ticket.ticketNumber() + " refers to a customer that does not exist.");
          }
          return (Ticket) ImmutableTicket.copyOf(ticket).withCustomer(customer);
        })
        .toList();
  }

  private List<Customer> fetch(final List<String> customerIds, final String... projection) {
    if (customerIds.isEmpty()) {
      return List.of();
    }
    final Map<String, Customer> found = new HashMap<>();
    dynamoDbStore.batchGet(TableNames.CUSTOMERS, customerIds.stream().map(this::key).toList(), projection)
        .stream()
        .map(customerConverter::fromItem)
        .forEach(customer -> found.put(customer.customerId(), customer));
    return customerIds.stream()
        .distinct()
        .map(found::get)
        .filter(Objects::nonNull)
        .toList();
  }

  private void validateName(final String fullName) {
    if (fullName == null || fullName.isBlank()) {
      throw new BadInputException("Invalid Name", "The full name can not be empty.");
    }
  }

  private void validatePhones(final List<PhoneNumber> phones) {
    final Set<String> seen = new HashSet<>();
    for (PhoneNumber phone : phones) {
      if (phone.number().isBlank()) {
        throw new BadInputException("Invalid Phone Numbers", "Phone numbers can not be empty.");
      }
      if (!seen.add(phone.number())) {
        throw new BadInputException("Invalid Phone Numbers", "Phone number " + phone.number() + " is listed twice.");
      }
    }
  }

  private Map<String, AttributeValue> key(final String customerId) {
    return ItemBuilder.key(Attributes.CUSTOMER_ID, customerId);
  }

  private NotFoundException notFound(final String customerId) {
    return new NotFoundException("Customer Not Found", "No customer with id " + customerId + ".");
  }

}
