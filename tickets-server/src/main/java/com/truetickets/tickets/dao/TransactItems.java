package com.truetickets.tickets.dao;

import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionCheck;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.Update;

/**
 * Factory for the members of a transactional write. Each member that has expressions needs its own
 * {@link ExpressionBuilder}, the store rejects names or values a member does not use.
 */
public final class TransactItems {

  private TransactItems() {
  }

  /**
   * Unconditional put.
   *
   * @param table the table
   * @param item  the item
   * @return the transact write item
   */
  public static TransactWriteItem put(final String table, final Map<String, AttributeValue> item) {
    return TransactWriteItem.builder()
        .put(Put.builder().tableName(table).item(item).build())
        .build();
  }

  /**
   * Conditional put.
   *
   * @param table     the table
   * @param item      the item
   * @param builder   the builder holding the condition's placeholders
   * @param condition the condition
   * @return the transact write item
   */
  public static TransactWriteItem put(final String table,
                                      final Map<String, AttributeValue> item,
                                      final ExpressionBuilder builder,
                                      final String condition) {
    return TransactWriteItem.builder()
        .put(Put.builder().tableName(table).item(item)
            .conditionExpression(condition)
            .expressionAttributeNames(builder.names())
            .expressionAttributeValues(builder.values())
            .build())
        .build();
  }

  /**
   * Update from the builder's SET and REMOVE actions.
   *
   * @param table     the table
   * @param key       the key
   * @param builder   the builder
   * @param condition the condition, nullable
   * @return the transact write item
   */
  public static TransactWriteItem update(final String table,
                                         final Map<String, AttributeValue> key,
                                         final ExpressionBuilder builder,
                                         final String condition) {
    return TransactWriteItem.builder()
        .update(Update.builder().tableName(table).key(key)
            .updateExpression(builder.updateExpression())
            .conditionExpression(condition)
            .expressionAttributeNames(builder.names())
            .expressionAttributeValues(builder.values())
            .build())
        .build();
  }

  /**
   * Unconditional delete.
   *
   * @param table the table
   * @param key   the key
   * @return the transact write item
   */
  public static TransactWriteItem delete(final String table, final Map<String, AttributeValue> key) {
    return TransactWriteItem.builder()
        .delete(Delete.builder().tableName(table).key(key).build())
        .build();
  }

  /**
   * Condition on an item the transaction does not write.
   *
   * @param table     the table
   * @param key       the key
   * @param builder   the builder
   * @param condition the condition
   * @return the transact write item
   */
  public static TransactWriteItem conditionCheck(final String table,
                                                 final Map<String, AttributeValue> key,
                                                 final ExpressionBuilder builder,
                                                 final String condition) {
    return TransactWriteItem.builder()
        .conditionCheck(ConditionCheck.builder().tableName(table).key(key)
            .conditionExpression(condition)
            .expressionAttributeNames(builder.names())
            .expressionAttributeValues(builder.values())
            .build())
        .build();
  }

}
