package com.truetickets.tickets.manager;

import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.dao.ExpressionBuilder;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Whitespace separated, case insensitive search words. An item matches when its attribute contains every word.
 */
public final class SearchTerms {

  /**
   * Most results a search returns.
   */
  public static final int MAX_RESULTS = 15;

  private SearchTerms() {
  }

  /**
   * Lower case words of the query.
   *
   * @param query the query
   * @return the list
   */
  public static List<String> tokenize(final String query) {
    if (query == null) {
      return List.of();
    }
    return Arrays.stream(query.trim().split("\\s+"))
        .filter(word -> !word.isEmpty())
        .map(word -> word.toLowerCase(Locale.ROOT))
        .toList();
  }

  /**
   * Filter that requires the attribute to contain every word.
   *
   * @param expressions the builder for the request
   * @param attribute   the attribute
   * @param words       the words
   * @return the filter expression
   */
  public static String containsAll(final ExpressionBuilder expressions,
                                   final String attribute,
                                   final List<String> words) {
    final String name = expressions.name(attribute);
    return words.stream()
        .map(word -> "contains(" + name + ", " + expressions.value(AttributeValues.s(word)) + ")")
        .collect(Collectors.joining(" AND "));
  }

}
