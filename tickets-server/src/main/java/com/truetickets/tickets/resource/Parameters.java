package com.truetickets.tickets.resource;

import com.truetickets.server.exception.BadInputException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reads query parameters and bodies, turning anything missing or malformed into a 400.
 */
public final class Parameters {

  private Parameters() {
  }

  /**
   * If the parameter was sent. An empty value counts as sent, like {@code ?get_recent}.
   *
   * @param value the value
   * @return the boolean
   */
  public static boolean present(final String value) {
    return value != null;
  }

  /**
   * How many of the values were sent.
   *
   * @param values the values
   * @return the count
   */
  public static long countPresent(final String... values) {
    return Arrays.stream(values).filter(Objects::nonNull).count();
  }

  /**
   * A required, non blank parameter.
   *
   * @param name  the name
   * @param value the value
   * @return the trimmed value
   */
  public static String required(final String name, final String value) {
    if (value == null || value.isBlank()) {
      throw new BadInputException("Missing Parameter", name + " is required.");
    }
    return value.trim();
  }

  /**
   * A required whole number.
   *
   * @param name  the name
   * @param value the value
   * @return the long
   */
  public static long requiredLong(final String name, final String value) {
    final String text = required(name, value);
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new BadInputException("Invalid Parameter", name + " must be a whole number, not '" + text + "'.");
    }
  }

  /**
   * A required whole number that fits an int.
   *
   * @param name  the name
   * @param value the value
   * @return the int
   */
  public static int requiredInt(final String name, final String value) {
    final long number = requiredLong(name, value);
    if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new BadInputException("Invalid Parameter", name + " is out of range.");
    }
    return (int) number;
  }

  /**
   * The request body, which jersey leaves null when none was sent.
   *
   * @param body the body
   * @param <T>  the type of the body
   * @return the body
   */
  public static <T> T body(final T body) {
    if (body == null) {
      throw new BadInputException("Missing Body", "A JSON request body is required.");
    }
    return body;
  }

}
