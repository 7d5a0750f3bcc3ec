package com.truetickets.tickets.converter;

import com.truetickets.api.v1.model.ImmutableStoreConfig;
import com.truetickets.api.v1.model.StoreConfig;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ItemBuilder;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Items of the Config table. The store settings and the per user singletons share the table, keyed by pk.
 */
@Singleton
public class StoreConfigConverter {

  /**
   * Key of the store settings.
   */
  public static final String STORE_CONFIG_PK = "config";

  private static final String CLOCK_STATE_SUFFIX = "#is_clocked_in";
  private static final String WAGE_SUFFIX = "#wage";

  private static final Logger LOGGER = LoggerFactory.getLogger(StoreConfigConverter.class);

  /**
   * Instantiates a new Store config converter.
   */
  @Inject
  public StoreConfigConverter() {
    LOGGER.info("StoreConfigConverter()");
  }

  /**
   * Key of the store settings.
   *
   * @return the map
   */
  public Map<String, AttributeValue> storeConfigKey() {
    return ItemBuilder.key(Attributes.PK, STORE_CONFIG_PK);
  }

  /**
   * Key of the user's clock state.
   *
   * @param userName the user name
   * @return the map
   */
  public Map<String, AttributeValue> clockStateKey(final String userName) {
    return ItemBuilder.key(Attributes.PK, clockStatePk(userName));
  }

  /**
   * The user's clock state.
   *
   * @param userName  the user name
   * @param clockedIn if clocked in
   * @param now       the now
   * @return the map
   */
  public Map<String, AttributeValue> clockStateItem(final String userName, final boolean clockedIn, final long now) {
    return ItemBuilder.item()
        .with(Attributes.PK, clockStatePk(userName))
        .with(Attributes.CLOCKED_IN, clockedIn)
        .with(Attributes.LAST_UPDATED, now)
        .build();
  }

  /**
   * Key of the user's wage.
   *
   * @param userName the user name
   * @return the map
   */
  public Map<String, AttributeValue> wageKey(final String userName) {
    return ItemBuilder.key(Attributes.PK, wagePk(userName));
  }

  /**
   * The user's wage.
   *
   * @param userName  the user name
   * @param wageCents the wage cents
   * @return the map
   */
  public Map<String, AttributeValue> wageItem(final String userName, final long wageCents) {
    return ItemBuilder.item()
        .with(Attributes.PK, wagePk(userName))
        .with(Attributes.WAGE_CENTS, wageCents)
        .build();
  }

  /**
   * The user a wage item belongs to, if the key is a wage key.
   *
   * @param pk the pk
   * @return the optional
   */
  public Optional<String> wageOwner(final String pk) {
    return pk.endsWith(WAGE_SUFFIX)
        ? Optional.of(pk.substring(0, pk.length() - WAGE_SUFFIX.length()))
        : Optional.empty();
  }

  private String clockStatePk(final String userName) {
    return userName + CLOCK_STATE_SUFFIX;
  }

  private String wagePk(final String userName) {
    return userName + WAGE_SUFFIX;
  }

  public Map<String, AttributeValue> toItem(final StoreConfig config) {
    return ItemBuilder.item()
        .with(Attributes.PK, STORE_CONFIG_PK)
        .with(Attributes.STORE_NAME, config.storeName())
        .with(Attributes.TAX_RATE, AttributeValues.n(config.taxRate()))
        .withIfNotEmpty(Attributes.ADDRESS, config.address())
        .withIfNotEmpty(Attributes.CITY, config.city())
        .withIfNotEmpty(Attributes.STATE, config.state())
        .withIfNotEmpty(Attributes.ZIP, config.zip())
        .withIfNotEmpty(Attributes.PHONE, config.phone())
        .withIfNotEmpty(Attributes.EMAIL, config.email())
        .withIfNotEmpty(Attributes.DISCLAIMER, config.disclaimer())
        .build();
  }

  public StoreConfig fromItem(final Map<String, AttributeValue> item) {
    return ImmutableStoreConfig.builder()
        .storeName(AttributeValues.optionalString(item, Attributes.STORE_NAME).orElse(""))
        .taxRate(AttributeValues.optionalDecimal(item, Attributes.TAX_RATE).orElse(0.0))
        .address(AttributeValues.optionalString(item, Attributes.ADDRESS))
        .city(AttributeValues.optionalString(item, Attributes.CITY))
        .state(AttributeValues.optionalString(item, Attributes.STATE))
        .zip(AttributeValues.optionalString(item, Attributes.ZIP))
        .phone(AttributeValues.optionalString(item, Attributes.PHONE))
        .email(AttributeValues.optionalString(item, Attributes.EMAIL))
        .disclaimer(AttributeValues.optionalString(item, Attributes.DISCLAIMER))
        .build();
  }

}
