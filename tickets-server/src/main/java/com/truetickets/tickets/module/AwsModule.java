package com.truetickets.tickets.module;

import com.truetickets.tickets.model.AttachmentsConfiguration;
import com.truetickets.tickets.model.DynamoDbConfiguration;
import dagger.Module;
import dagger.Provides;
import java.net.URI;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * The aws clients. They are thread safe and shared by every request.
 */
@Module
public class AwsModule {

  private static final Logger LOGGER = LoggerFactory.getLogger(AwsModule.class);

  /**
   * Dynamo db client.
   *
   * @param configuration the configuration
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient(final DynamoDbConfiguration configuration) {
    LOGGER.info("dynamoDbClient({})", configuration);
    final DynamoDbClientBuilder builder = DynamoDbClient.builder()
        .region(Region.of(configuration.region()));
    configuration.endpoint().filter(endpoint -> !endpoint.isBlank()).map(URI::create).ifPresent(builder::endpointOverride);
    return builder.build();
  }

  /**
   * S3 client.
   *
   * @param configuration the configuration
   * @return the s3 client
   */
  @Provides
  @Singleton
  public S3Client s3Client(final AttachmentsConfiguration configuration) {
    LOGGER.info("s3Client({})", configuration);
    return S3Client.builder()
        .region(Region.of(configuration.region()))
        .build();
  }

}
