package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.ImmutableWage;
import com.truetickets.api.v1.model.Wage;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.StoreConfigConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.TableNames;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * Hourly wages, kept per user in the Config table. A user without a wage earns 0.
 */
@Singleton
public class WageManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(WageManager.class);

  private final DynamoDbStore dynamoDbStore;
  private final StoreConfigConverter storeConfigConverter;

  /**
   * Instantiates a new Wage manager.
   *
   * @param dynamoDbStore        the dynamo db store
   * @param storeConfigConverter the store config converter
   */
  @Inject
  public WageManager(final DynamoDbStore dynamoDbStore,
                     final StoreConfigConverter storeConfigConverter) {
    LOGGER.info("WageManager({})", dynamoDbStore);
    this.dynamoDbStore = dynamoDbStore;
    this.storeConfigConverter = storeConfigConverter;
  }

  /**
   * The user's wage.
   *
   * @param userName the user name
   * @return the wage
   */
  public Wage get(final String userName) {
    LOGGER.trace("get({})", userName);
    requireUserName(userName);
    final long cents = dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.wageKey(userName), false)
        .flatMap(item -> AttributeValues.optionalNumber(item, Attributes.WAGE_CENTS))
        .orElse(0L);
    return ImmutableWage.builder().userName(userName).wageCents(cents).build();
  }

  /**
   * Replace the user's wage.
   *
   * @param wage the wage
   * @return the wage
   */
  public Wage set(final Wage wage) {
    LOGGER.trace("set({})", wage.userName());
    requireUserName(wage.userName());
    if (wage.wageCents() < 0) {
      throw new BadInputException("Invalid Wage", "The wage can not be negative.");
    }
    dynamoDbStore.put(PutItemRequest.builder().tableName(TableNames.CONFIG)
        .item(storeConfigConverter.wageItem(wage.userName(), wage.wageCents()))
        .build());
    return wage;
  }

  /**
   * Wages of the users, in the order given.
   *
   * @param userNames the user names
   * @return the list
   */
  public List<Wage> wages(final Collection<String> userNames) {
    LOGGER.trace("wages({})", userNames);
    if (userNames.isEmpty()) {
      return List.of();
    }
    final Map<String, Long> found = new HashMap<>();
    dynamoDbStore.batchGet(TableNames.CONFIG,
            userNames.stream().map(storeConfigConverter::wageKey).toList(),
            Attributes.PK, Attributes.WAGE_CENTS)
        .forEach(item -> storeConfigConverter.wageOwner(AttributeValues.string(item, Attributes.PK))
            .ifPresent(owner -> found.put(owner,
                AttributeValues.optionalNumber(item, Attributes.WAGE_CENTS).orElse(0L))));
    return userNames.stream()
        .distinct()
        .map(userName -> (Wage) ImmutableWage.builder()
            .userName(userName)
            .wageCents(found.getOrDefault(userName, 0L))
            .build())
        .toList();
  }

  private void requireUserName(final String userName) {
    if (userName == null || userName.isBlank()) {
      throw new BadInputException("Missing Parameter", "user_name is required.");
    }
  }

}
