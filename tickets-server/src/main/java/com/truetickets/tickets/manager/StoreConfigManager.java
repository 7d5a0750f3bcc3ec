package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.StoreConfig;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.StoreConfigConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.TableNames;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * The shop wide settings. Nothing is cached, a change applies to the next request.
 */
@Singleton
public class StoreConfigManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(StoreConfigManager.class);

  private final DynamoDbStore dynamoDbStore;
  private final StoreConfigConverter storeConfigConverter;

  /**
   * Instantiates a new Store config manager.
   *
   * @param dynamoDbStore        the dynamo db store
   * @param storeConfigConverter the store config converter
   */
  @Inject
  public StoreConfigManager(final DynamoDbStore dynamoDbStore,
                            final StoreConfigConverter storeConfigConverter) {
    LOGGER.info("StoreConfigManager({})", dynamoDbStore);
    this.dynamoDbStore = dynamoDbStore;
    this.storeConfigConverter = storeConfigConverter;
  }

  /**
   * The settings, if they were ever saved.
   *
   * @return the optional
   */
  public Optional<StoreConfig> get() {
    LOGGER.trace("get()");
    return dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.storeConfigKey(), false)
        .map(storeConfigConverter::fromItem);
  }

  /**
   * Replace the settings.
   *
   * @param config the config
   * @return the store config
   */
  public StoreConfig put(final StoreConfig config) {
    LOGGER.trace("put({})", config.storeName());
    if (config.storeName().isBlank()) {
      throw new BadInputException("Invalid Store Config", "store_name can not be empty.");
    }
    if (Double.isNaN(config.taxRate()) || config.taxRate() < 0 || config.taxRate() > 100) {
      throw new BadInputException("Invalid Store Config", "tax_rate must be between 0 and 100.");
    }
    dynamoDbStore.put(PutItemRequest.builder()
        .tableName(TableNames.CONFIG)
        .item(storeConfigConverter.toItem(config))
        .build());
    return config;
  }

  /**
   * The tax rate in percent, read consistently. 0 when never set.
   *
   * @return the double
   */
  public double taxRate() {
    return dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.storeConfigKey(), true, Attributes.TAX_RATE)
        .flatMap(item -> AttributeValues.optionalDecimal(item, Attributes.TAX_RATE))
        .orElse(0.0);
  }

}
