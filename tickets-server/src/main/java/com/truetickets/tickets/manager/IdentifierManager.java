package com.truetickets.tickets.manager;

import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.StoreConflictException;
import com.truetickets.tickets.dao.TableNames;
import java.security.SecureRandom;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Hands out identifiers. Short ids are random and only checked for collisions when written. Ticket numbers come from
 * a counter the store increments atomically, so they are never handed out twice.
 */
@Singleton
public class IdentifierManager {

  /**
   * Name of the ticket number counter.
   */
  public static final String TICKET_NUMBER_COUNTER = "ticket_number";
  /**
   * Length of customer ids.
   */
  public static final int CUSTOMER_ID_LENGTH = 10;

  private static final Logger LOGGER = LoggerFactory.getLogger(IdentifierManager.class);
  private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

  private final SecureRandom secureRandom;
  private final DynamoDbStore dynamoDbStore;

  /**
   * Instantiates a new Identifier manager.
   *
   * @param secureRandom  the secure random
   * @param dynamoDbStore the dynamo db store
   */
  @Inject
  public IdentifierManager(final SecureRandom secureRandom,
                           final DynamoDbStore dynamoDbStore) {
    LOGGER.info("IdentifierManager({},{})", secureRandom, dynamoDbStore);
    this.secureRandom = secureRandom;
    this.dynamoDbStore = dynamoDbStore;
  }

  /**
   * Random base36 string.
   *
   * @param length the length
   * @return the string
   */
  public String shortId(final int length) {
    final char[] chars = new char[length];
    for (int i = 0; i < length; i++) {
      chars[i] = ALPHABET[secureRandom.nextInt(ALPHABET.length)];
    }
    return new String(chars);
  }

  /**
   * Increments the counter and returns the new value, which is the caller's to use.
   *
   * @return the long
   */
  public long nextTicketNumber() {
    LOGGER.trace("nextTicketNumber()");
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final String counter = expressions.name(Attributes.COUNTER_VALUE);
    expressions.setExpression(Attributes.COUNTER_VALUE, String.format("if_not_exists(%s, %s) + %s",
        counter, expressions.value(AttributeValues.n(0L)), expressions.value(AttributeValues.n(1L))));
    final UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(TableNames.COUNTERS)
        .key(counterKey())
        .updateExpression(expressions.updateExpression())
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .returnValues(ReturnValue.UPDATED_NEW)
        .build();
    final Map<String, AttributeValue> attributes = dynamoDbStore.update(request);
    final long ticketNumber = AttributeValues.number(attributes, Attributes.COUNTER_VALUE);
    LOGGER.debug("nextTicketNumber() -> {}", ticketNumber);
    return ticketNumber;
  }

  /**
   * The last ticket number handed out, 0 when none was.
   *
   * @return the long
   */
  public long currentTicketNumber() {
    return dynamoDbStore.get(TableNames.COUNTERS, counterKey(), true, Attributes.COUNTER_VALUE)
        .flatMap(item -> AttributeValues.optionalNumber(item, Attributes.COUNTER_VALUE))
        .orElse(0L);
  }

  /**
   * Moves the counter up to the value. The counter never moves down, asking for a lower value fails.
   *
   * @param value the value
   */
  public void raiseTicketNumber(final long value) {
    LOGGER.trace("raiseTicketNumber({})", value);
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final String counter = expressions.name(Attributes.COUNTER_VALUE);
    final String newValue = expressions.value(AttributeValues.n(value));
    expressions.setExpression(Attributes.COUNTER_VALUE, newValue);
    final UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(TableNames.COUNTERS)
        .key(counterKey())
        .updateExpression(expressions.updateExpression())
        .conditionExpression(String.format("attribute_not_exists(%s) OR %s <= %s", counter, counter, newValue))
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    try {
      dynamoDbStore.update(request);
    } catch (StoreConflictException e) {
      LOGGER.warn("raiseTicketNumber({}): counter is already higher", value);
      throw new InternalException("Counter Update Error",
          "The ticket number counter is already past " + value + ".", e);
    }
  }

  private Map<String, AttributeValue> counterKey() {
    return ItemBuilder.key(Attributes.COUNTER_NAME, TICKET_NUMBER_COUNTER);
  }

}
