package com.truetickets.tickets.converter;

import com.truetickets.server.exception.InternalException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Reads typed values out of store items. A required attribute that is missing or of the wrong type means the stored
 * data is not what we wrote, so it is an internal error and not bad input.
 */
public final class AttributeValues {

  private AttributeValues() {
  }

  public static AttributeValue s(final String value) {
    return AttributeValue.fromS(value);
  }

  public static AttributeValue n(final long value) {
    return AttributeValue.fromN(Long.toString(value));
  }

  public static AttributeValue n(final double value) {
    return AttributeValue.fromN(Double.toString(value));
  }

  public static AttributeValue bool(final boolean value) {
    return AttributeValue.fromBool(value);
  }

  /**
   * Required string.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the string
   */
  public static String string(final Map<String, AttributeValue> item, final String attribute) {
    return optionalString(item, attribute).orElseThrow(() -> missing(attribute));
  }

  /**
   * Optional string.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the optional
   */
  public static Optional<String> optionalString(final Map<String, AttributeValue> item, final String attribute) {
    final AttributeValue value = item.get(attribute);
    if (value == null || Boolean.TRUE.equals(value.nul())) {
      return Optional.empty();
    }
    if (value.s() == null) {
      throw wrongType(attribute, "S");
    }
    return Optional.of(value.s());
  }

  /**
   * Required number.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the long
   */
  public static long number(final Map<String, AttributeValue> item, final String attribute) {
    return optionalNumber(item, attribute).orElseThrow(() -> missing(attribute));
  }

  /**
   * Optional number.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the optional
   */
  public static Optional<Long> optionalNumber(final Map<String, AttributeValue> item, final String attribute) {
    return optionalDecimal(item, attribute).map(d -> Math.round(d));
  }

  /**
   * Optional decimal number.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the optional
   */
  public static Optional<Double> optionalDecimal(final Map<String, AttributeValue> item, final String attribute) {
    final AttributeValue value = item.get(attribute);
    if (value == null || Boolean.TRUE.equals(value.nul())) {
      return Optional.empty();
    }
    if (value.n() == null) {
      throw wrongType(attribute, "N");
    }
    try {
      return Optional.of(Double.parseDouble(value.n()));
    } catch (NumberFormatException e) {
      throw new InternalException("Deserialization Error", "Attribute " + attribute + " is not a number", e);
    }
  }

  /**
   * Boolean, false when absent.
   *
   * @param item      the item
   * @param attribute the attribute
   * @return the boolean
   */
  public static boolean flag(final Map<String, AttributeValue> item, final String attribute) {
    final AttributeValue value = item.get(attribute);
    if (value == null || value.bool() == null) {
      return false;
    }
    return value.bool();
  }

  /**
   * List elements, empty when absent.
   *
   * @param item      the item
   * @param attribute the attribute
   * @param reader    converts one element
   * @param <T>       the element type
   * @return the list
   */
  public static <T> List<T> list(final Map<String, AttributeValue> item,
                                 final String attribute,
                                 final Function<AttributeValue, T> reader) {
    final AttributeValue value = item.get(attribute);
    if (value == null || Boolean.TRUE.equals(value.nul())) {
      return List.of();
    }
    if (!value.hasL()) {
      throw wrongType(attribute, "L");
    }
    return value.l().stream().map(reader).toList();
  }

  /**
   * The map of a map element.
   *
   * @param value the value
   * @return the map
   */
  public static Map<String, AttributeValue> map(final AttributeValue value) {
    if (!value.hasM()) {
      throw new InternalException("Deserialization Error", "Expected a map element");
    }
    return value.m();
  }

  /**
   * The string of a string element.
   *
   * @param value the value
   * @return the string
   */
  public static String stringElement(final AttributeValue value) {
    if (value.s() == null) {
      throw new InternalException("Deserialization Error", "Expected a string element");
    }
    return value.s();
  }

  private static InternalException missing(final String attribute) {
    return new InternalException("Deserialization Error", "Missing attribute " + attribute);
  }

  private static InternalException wrongType(final String attribute, final String expected) {
    return new InternalException("Deserialization Error",
        "Attribute " + attribute + " is not of type " + expected);
  }

}
