package com.truetickets.tickets.health;

import com.codahale.metrics.health.HealthCheck;
import com.truetickets.tickets.dao.TableNames;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Healthy while the tickets table can be described and is active.
 */
@Singleton
public class DynamoDbHealthCheck extends HealthCheck {

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamoDbHealthCheck.class);

  private final DynamoDbClient dynamoDbClient;

  /**
   * Instantiates a new Dynamo db health check.
   *
   * @param dynamoDbClient the dynamo db client
   */
  @Inject
  public DynamoDbHealthCheck(final DynamoDbClient dynamoDbClient) {
    LOGGER.info("DynamoDbHealthCheck({})", dynamoDbClient);
    this.dynamoDbClient = dynamoDbClient;
  }

  @Override
  protected Result check() {
    try {
      final TableStatus status = dynamoDbClient.describeTable(
          DescribeTableRequest.builder().tableName(TableNames.TICKETS).build()).table().tableStatus();
      if (status == TableStatus.ACTIVE) {
        return Result.healthy();
      }
      return Result.unhealthy("Table " + TableNames.TICKETS + " is " + status);
    } catch (SdkException e) {
      LOGGER.warn("check(): {}", e.getMessage());
      return Result.unhealthy(e);
    }
  }

}
