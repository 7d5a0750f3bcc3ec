package com.truetickets.tickets.dao;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Collects the attribute names and values of the expressions of one request, so conditions, updates and projections
 * can share the placeholders. Every attribute goes through a name placeholder, so reserved words like status and
 * timestamp need no special care. Not thread safe, use one per request.
 */
public class ExpressionBuilder {

  private final Map<String, String> names = new LinkedHashMap<>();
  private final Map<String, AttributeValue> values = new LinkedHashMap<>();
  private final List<String> setActions = new ArrayList<>();
  private final List<String> removeActions = new ArrayList<>();

  /**
   * Placeholder for the attribute name.
   *
   * @param attribute the attribute
   * @return the placeholder, like #status
   */
  public String name(final String attribute) {
    final String placeholder = "#" + attribute;
    names.put(placeholder, attribute);
    return placeholder;
  }

  /**
   * Placeholder for the value.
   *
   * @param value the value
   * @return the placeholder, like :v3
   */
  public String value(final AttributeValue value) {
    final String placeholder = ":v" + values.size();
    values.put(placeholder, value);
    return placeholder;
  }

  /**
   * Adds 'attribute = value' to the SET clause.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this
   */
  public ExpressionBuilder set(final String attribute, final AttributeValue value) {
    setActions.add(name(attribute) + " = " + value(value));
    return this;
  }

  /**
   * Adds 'attribute = expression' to the SET clause, for functions and arithmetic.
   *
   * @param attribute  the attribute
   * @param expression the right hand side, built with this builder's placeholders
   * @return this
   */
  public ExpressionBuilder setExpression(final String attribute, final String expression) {
    setActions.add(name(attribute) + " = " + expression);
    return this;
  }

  /**
   * Appends the values to a list attribute, creating the list when absent.
   *
   * @param attribute the list attribute
   * @param elements  the elements to append
   * @return this
   */
  public ExpressionBuilder append(final String attribute, final List<AttributeValue> elements) {
    final String attributeName = name(attribute);
    return setExpression(attribute, String.format("list_append(if_not_exists(%s, %s), %s)",
        attributeName, value(AttributeValue.fromL(List.of())), value(AttributeValue.fromL(elements))));
  }

  /**
   * Adds the attribute to the REMOVE clause.
   *
   * @param attribute the attribute
   * @return this
   */
  public ExpressionBuilder remove(final String attribute) {
    removeActions.add(name(attribute));
    return this;
  }

  /**
   * If any SET or REMOVE action was added.
   *
   * @return the boolean
   */
  public boolean hasUpdates() {
    return !setActions.isEmpty() || !removeActions.isEmpty();
  }

  /**
   * The update expression from the SET and REMOVE actions.
   *
   * @return the string
   */
  public String updateExpression() {
    final StringBuilder builder = new StringBuilder();
    if (!setActions.isEmpty()) {
      builder.append("SET ").append(String.join(", ", setActions));
    }
    if (!removeActions.isEmpty()) {
      if (builder.length() > 0) {
        builder.append(' ');
      }
      builder.append("REMOVE ").append(String.join(", ", removeActions));
    }
    return builder.toString();
  }

  /**
   * Projection expression for the attributes.
   *
   * @param attributes the attributes
   * @return the string
   */
  public String projection(final String... attributes) {
    return Arrays.stream(attributes).map(this::name).collect(Collectors.joining(", "));
  }

  /**
   * Names, or null when none were used since the store rejects empty maps.
   *
   * @return the map
   */
  public Map<String, String> names() {
    return names.isEmpty() ? null : Map.copyOf(names);
  }

  /**
   * Values, or null when none were used since the store rejects empty maps.
   *
   * @return the map
   */
  public Map<String, AttributeValue> values() {
    return values.isEmpty() ? null : Map.copyOf(values);
  }

}
