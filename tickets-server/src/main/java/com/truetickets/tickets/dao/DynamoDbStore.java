package com.truetickets.tickets.dao;

import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.InternalException;
import com.truetickets.server.exception.PartialBatchException;
import com.truetickets.server.exception.ServiceException;
import com.truetickets.server.exception.ThrottledException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Typed wrapper over the store. Every call goes through here so that store failures become service exceptions in one
 * place: throttling and server errors are retryable, failed conditions are conflicts, anything else is internal.
 */
@Singleton
public class DynamoDbStore {

  /**
   * Most members a transactional write may have.
   */
  public static final int MAX_TRANSACTION_ITEMS = 25;
  /**
   * Most keys a single batch get may ask for.
   */
  public static final int MAX_BATCH_KEYS = 100;

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamoDbStore.class);

  private final DynamoDbClient dynamoDbClient;

  /**
   * Instantiates a new Dynamo db store.
   *
   * @param dynamoDbClient the dynamo db client
   */
  @Inject
  public DynamoDbStore(final DynamoDbClient dynamoDbClient) {
    LOGGER.info("DynamoDbStore({})", dynamoDbClient);
    this.dynamoDbClient = dynamoDbClient;
  }

  /**
   * Get an item.
   *
   * @param table      the table
   * @param key        the key
   * @param consistent if the read is strongly consistent
   * @param projection the attributes to read, all when empty
   * @return the item if present
   */
  public Optional<Map<String, AttributeValue>> get(final String table,
                                                   final Map<String, AttributeValue> key,
                                                   final boolean consistent,
                                                   final String... projection) {
    LOGGER.trace("get({},{},{})", table, key, consistent);
    final GetItemRequest.Builder builder = GetItemRequest.builder()
        .tableName(table)
        .key(key)
        .consistentRead(consistent);
    if (projection.length > 0) {
      final ExpressionBuilder expressions = new ExpressionBuilder();
      builder.projectionExpression(expressions.projection(projection))
          .expressionAttributeNames(expressions.names());
    }
    final GetItemResponse response = call("get " + table, () -> dynamoDbClient.getItem(builder.build()));
    return response.hasItem() && !response.item().isEmpty() ? Optional.of(response.item()) : Optional.empty();
  }

  /**
   * Get many items from one table. Duplicate keys are asked for once and the keys are split into batches the store
   * accepts. The result order is not the key order. If the store leaves any key unprocessed the whole call fails,
   * the caller never sees a partial result.
   *
   * @param table      the table
   * @param keys       the keys
   * @param projection the attributes to read, all when empty
   * @return the items found
   */
  public List<Map<String, AttributeValue>> batchGet(final String table,
                                                    final Collection<Map<String, AttributeValue>> keys,
                                                    final String... projection) {
    LOGGER.trace("batchGet({},{})", table, keys.size());
    final List<Map<String, AttributeValue>> unique = new ArrayList<>(new LinkedHashSet<>(keys));
    final List<Map<String, AttributeValue>> result = new ArrayList<>();
    for (int start = 0; start < unique.size(); start += MAX_BATCH_KEYS) {
      final List<Map<String, AttributeValue>> chunk =
          unique.subList(start, Math.min(unique.size(), start + MAX_BATCH_KEYS));
      final KeysAndAttributes.Builder keysAndAttributes = KeysAndAttributes.builder().keys(chunk);
      if (projection.length > 0) {
        final ExpressionBuilder expressions = new ExpressionBuilder();
        keysAndAttributes.projectionExpression(expressions.projection(projection))
            .expressionAttributeNames(expressions.names());
      }
      final BatchGetItemRequest request = BatchGetItemRequest.builder()
          .requestItems(Map.of(table, keysAndAttributes.build()))
          .build();
      final BatchGetItemResponse response = call("batchGet " + table, () -> dynamoDbClient.batchGetItem(request));
      if (response.hasUnprocessedKeys() && !response.unprocessedKeys().isEmpty()) {
        LOGGER.warn("batchGet({}) left keys unprocessed: {}", table, response.unprocessedKeys().keySet());
        throw new PartialBatchException("Partial Batch",
            "Some records could not be read right now.",
            "Retry the request.");
      }
      if (response.hasResponses()) {
        result.addAll(response.responses().getOrDefault(table, List.of()));
      }
    }
    return result;
  }

  /**
   * Query, following the pages until the results are exhausted or the limit of matching items is reached.
   *
   * @param request  the first page's request
   * @param maxItems the most items to return
   * @return the items
   */
  public List<Map<String, AttributeValue>> query(final QueryRequest request, final int maxItems) {
    LOGGER.trace("query({},{},{})", request.tableName(), request.indexName(), maxItems);
    final List<Map<String, AttributeValue>> result = new ArrayList<>();
    QueryRequest page = request;
    while (true) {
      final QueryRequest current = page;
      final QueryResponse response = call("query " + request.tableName(), () -> dynamoDbClient.query(current));
      for (Map<String, AttributeValue> item : response.items()) {
        if (result.size() >= maxItems) {
          return result;
        }
        result.add(item);
      }
      if (result.size() >= maxItems || !response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
        return result;
      }
      page = page.toBuilder().exclusiveStartKey(response.lastEvaluatedKey()).build();
    }
  }

  /**
   * Scan, following the pages until the results are exhausted or the limit of matching items is reached.
   *
   * @param request  the first page's request
   * @param maxItems the most items to return
   * @return the items
   */
  public List<Map<String, AttributeValue>> scan(final ScanRequest request, final int maxItems) {
    LOGGER.trace("scan({},{})", request.tableName(), maxItems);
    final List<Map<String, AttributeValue>> result = new ArrayList<>();
    ScanRequest page = request;
    while (true) {
      final ScanRequest current = page;
      final ScanResponse response = call("scan " + request.tableName(), () -> dynamoDbClient.scan(current));
      for (Map<String, AttributeValue> item : response.items()) {
        if (result.size() >= maxItems) {
          return result;
        }
        result.add(item);
      }
      if (result.size() >= maxItems || !response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
        return result;
      }
      page = page.toBuilder().exclusiveStartKey(response.lastEvaluatedKey()).build();
    }
  }

  /**
   * Single item update.
   *
   * @param request the request
   * @return the attributes the request asked to have returned
   */
  public Map<String, AttributeValue> update(final UpdateItemRequest request) {
    LOGGER.trace("update({},{})", request.tableName(), request.key());
    final UpdateItemResponse response = call("update " + request.tableName(), () -> dynamoDbClient.updateItem(request));
    return response.hasAttributes() ? response.attributes() : Map.of();
  }

  /**
   * Single item put.
   *
   * @param request the request
   */
  public void put(final PutItemRequest request) {
    LOGGER.trace("put({})", request.tableName());
    call("put " + request.tableName(), () -> dynamoDbClient.putItem(request));
  }

  /**
   * All or nothing write.
   *
   * @param items the members
   */
  public void transactWrite(final List<TransactWriteItem> items) {
    LOGGER.trace("transactWrite({})", items.size());
    if (items.isEmpty()) {
      return;
    }
    if (items.size() > MAX_TRANSACTION_ITEMS) {
      throw new BadInputException("Too Many Changes",
          String.format("This change needs %d writes, at most %d can be made at once.",
              items.size(), MAX_TRANSACTION_ITEMS));
    }
    final TransactWriteItemsRequest request = TransactWriteItemsRequest.builder().transactItems(items).build();
    call("transactWrite", () -> dynamoDbClient.transactWriteItems(request));
  }

  private <T> T call(final String operation, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (ServiceException e) {
      throw e;
    } catch (ConditionalCheckFailedException e) {
      LOGGER.debug("{}: condition failed", operation);
      throw new StoreConflictException(List.of(StoreConflictException.CONDITIONAL_CHECK_FAILED), e);
    } catch (TransactionCanceledException e) {
      throw translateCancellation(operation, e);
    } catch (ProvisionedThroughputExceededException | RequestLimitExceededException e) {
      LOGGER.warn("{}: throttled", operation);
      throw throttled(e);
    } catch (DynamoDbException e) {
      if (e.isThrottlingException() || e.statusCode() >= 500) {
        LOGGER.warn("{}: retryable failure {}", operation, e.statusCode());
        throw throttled(e);
      }
      LOGGER.error("{}: store failure", operation, e);
      throw new InternalException("DynamoDB Error", operation + " failed: " + e.getMessage(), e);
    } catch (SdkClientException e) {
      LOGGER.warn("{}: client failure {}", operation, e.getMessage());
      throw throttled(e);
    }
  }

  private ServiceException translateCancellation(final String operation, final TransactionCanceledException e) {
    final List<String> reasons = e.hasCancellationReasons()
        ? e.cancellationReasons().stream()
        .map(CancellationReason::code)
        .map(code -> Objects.toString(code, "None"))
        .collect(Collectors.toList())
        : List.of();
    LOGGER.debug("{}: cancelled {}", operation, reasons);
    if (reasons.contains(StoreConflictException.CONDITIONAL_CHECK_FAILED) || reasons.contains("TransactionConflict")) {
      return new StoreConflictException(reasons, e);
    }
    if (reasons.contains("ThrottlingError") || reasons.contains("ProvisionedThroughputExceeded")) {
      return throttled(e);
    }
    LOGGER.error("{}: transaction cancelled {}", operation, reasons, e);
    return new InternalException("DynamoDB Error", operation + " cancelled: " + reasons, e);
  }

  private ThrottledException throttled(final Throwable cause) {
    return new ThrottledException("Service Busy", "The data store is busy right now.", cause);
  }

}
