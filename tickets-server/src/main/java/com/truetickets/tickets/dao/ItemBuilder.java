package com.truetickets.tickets.dao;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds items and keys. Optional values are only written when present and not empty, the store rejects empty
 * strings in key attributes and we never want empty lists lying around.
 */
public class ItemBuilder {

  private final Map<String, AttributeValue> item = new HashMap<>();

  /**
   * Start a new item.
   *
   * @return the item builder
   */
  public static ItemBuilder item() {
    return new ItemBuilder();
  }

  /**
   * Key with a string hash key.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the map
   */
  public static Map<String, AttributeValue> key(final String attribute, final String value) {
    return Map.of(attribute, AttributeValue.fromS(value));
  }

  /**
   * Key with a numeric hash key.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the map
   */
  public static Map<String, AttributeValue> key(final String attribute, final long value) {
    return Map.of(attribute, AttributeValue.fromN(Long.toString(value)));
  }

  public ItemBuilder with(final String attribute, final AttributeValue value) {
    item.put(attribute, value);
    return this;
  }

  public ItemBuilder with(final String attribute, final String value) {
    return with(attribute, AttributeValue.fromS(value));
  }

  public ItemBuilder with(final String attribute, final long value) {
    return with(attribute, AttributeValue.fromN(Long.toString(value)));
  }

  public ItemBuilder with(final String attribute, final boolean value) {
    return with(attribute, AttributeValue.fromBool(value));
  }

  /**
   * Adds the string only if present and not empty.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the item builder
   */
  public ItemBuilder withIfNotEmpty(final String attribute, final Optional<String> value) {
    value.filter(v -> !v.isEmpty()).ifPresent(v -> with(attribute, v));
    return this;
  }

  /**
   * Adds the number only if present.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the item builder
   */
  public ItemBuilder withIfPresent(final String attribute, final Optional<Long> value) {
    value.ifPresent(v -> with(attribute, v));
    return this;
  }

  /**
   * Adds the list only if it has elements.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the item builder
   */
  public ItemBuilder withIfNotEmpty(final String attribute, final List<AttributeValue> value) {
    if (!value.isEmpty()) {
      with(attribute, AttributeValue.fromL(value));
    }
    return this;
  }

  public Map<String, AttributeValue> build() {
    return Map.copyOf(item);
  }

}
