package com.truetickets.tickets.converter;

import static com.truetickets.tickets.converter.AttributeValues.bool;
import static com.truetickets.tickets.converter.AttributeValues.s;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.ImmutableCustomer;
import com.truetickets.api.v1.model.ImmutablePhoneNumber;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ItemBuilder;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Customer items, and the rows of the two customer indexes.
 */
@Singleton
public class CustomerConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CustomerConverter.class);

  /**
   * Instantiates a new Customer converter.
   */
  @Inject
  public CustomerConverter() {
    LOGGER.info("CustomerConverter()");
  }

  /**
   * To item.
   *
   * @param customer the customer
   * @return the map
   */
  public Map<String, AttributeValue> toItem(final Customer customer) {
    return ItemBuilder.item()
        .with(Attributes.CUSTOMER_ID, customer.customerId())
        .with(Attributes.FULL_NAME, customer.fullName())
        .withIfNotEmpty(Attributes.EMAIL, customer.email())
        .with(Attributes.PHONE_NUMBERS, phoneNumbers(customer.phoneNumbers()))
        .withIfPresent(Attributes.CREATED_AT, customer.createdAt())
        .withIfPresent(Attributes.LAST_UPDATED, customer.lastUpdated())
        .build();
  }

  /**
   * From item. Lookups that project only some attributes leave the timestamps out.
   *
   * @param item the item
   * @return the customer
   */
  public Customer fromItem(final Map<String, AttributeValue> item) {
    return ImmutableCustomer.builder()
        .customerId(AttributeValues.string(item, Attributes.CUSTOMER_ID))
        .fullName(AttributeValues.string(item, Attributes.FULL_NAME))
        .email(AttributeValues.optionalString(item, Attributes.EMAIL))
        .phoneNumbers(AttributeValues.list(item, Attributes.PHONE_NUMBERS, this::readPhoneNumber))
        .createdAt(AttributeValues.optionalNumber(item, Attributes.CREATED_AT))
        .lastUpdated(AttributeValues.optionalNumber(item, Attributes.LAST_UPDATED))
        .build();
  }

  /**
   * The phone list attribute.
   *
   * @param phoneNumbers the phone numbers
   * @return the attribute value
   */
  public AttributeValue phoneNumbers(final List<PhoneNumber> phoneNumbers) {
    return AttributeValue.fromL(phoneNumbers.stream().map(this::phoneNumber).toList());
  }

  /**
   * One phone number as a map element.
   *
   * @param phoneNumber the phone number
   * @return the attribute value
   */
  public AttributeValue phoneNumber(final PhoneNumber phoneNumber) {
    return AttributeValue.fromM(Map.of(
        Attributes.NUMBER, s(phoneNumber.number()),
        Attributes.PREFERS_TEXTING, bool(phoneNumber.prefersTexting()),
        Attributes.NO_ENGLISH, bool(phoneNumber.noEnglish())));
  }

  /**
   * Phone number from a map element.
   *
   * @param value the value
   * @return the phone number
   */
  public PhoneNumber readPhoneNumber(final AttributeValue value) {
    final Map<String, AttributeValue> map = AttributeValues.map(value);
    return ImmutablePhoneNumber.builder()
        .number(AttributeValues.string(map, Attributes.NUMBER))
        .prefersTexting(AttributeValues.flag(map, Attributes.PREFERS_TEXTING))
        .noEnglish(AttributeValues.flag(map, Attributes.NO_ENGLISH))
        .build();
  }

  /**
   * Row of the name index.
   *
   * @param customerId the customer id
   * @param fullName   the full name, lowered here
   * @return the map
   */
  public Map<String, AttributeValue> nameItem(final String customerId, final String fullName) {
    return ItemBuilder.item()
        .with(Attributes.CUSTOMER_ID, customerId)
        .with(Attributes.FULL_NAME_LC, lower(fullName))
        .build();
  }

  /**
   * Row of the phone index. The row is its own key.
   *
   * @param number     the number
   * @param customerId the customer id
   * @return the map
   */
  public Map<String, AttributeValue> phoneKey(final String number, final String customerId) {
    return Map.of(
        Attributes.PHONE_NUMBER, s(number),
        Attributes.CUSTOMER_ID, s(customerId));
  }

  /**
   * Lower case the way the indexes store names and subjects.
   *
   * @param value the value
   * @return the string
   */
  public static String lower(final String value) {
    return value.toLowerCase(Locale.ROOT);
  }

}
