package com.truetickets.tickets.module;

import com.codahale.metrics.health.HealthCheck;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.blob.BlobStore;
import com.truetickets.tickets.blob.S3BlobStore;
import com.truetickets.tickets.health.DynamoDbHealthCheck;
import com.truetickets.tickets.manager.SearchManager;
import com.truetickets.tickets.model.ShopConfiguration;
import com.truetickets.tickets.resource.AttachmentsResource;
import com.truetickets.tickets.resource.CustomersResource;
import com.truetickets.tickets.resource.FinancialsResource;
import com.truetickets.tickets.resource.MigrationResource;
import com.truetickets.tickets.resource.PaymentsResource;
import com.truetickets.tickets.resource.SearchResource;
import com.truetickets.tickets.resource.StoreSettingsResource;
import com.truetickets.tickets.resource.TicketsResource;
import com.truetickets.tickets.resource.TimeclockResource;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import dagger.multibindings.IntoSet;
import io.dropwizard.core.setup.Environment;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The tickets server module.
 */
@Module(includes = TicketsServerModule.Binder.class)
public class TicketsServerModule {

  /**
   * Threads available to run searches side by side.
   */
  public static final int SEARCH_THREADS = 8;

  /**
   * Clock clock.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Secure random secure random.
   *
   * @return the secure random
   */
  @Provides
  @Singleton
  SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * The zone months and days of the shop are counted in.
   *
   * @param shopConfiguration the shop configuration
   * @return the zone id
   */
  @Provides
  @Singleton
  ZoneId zoneId(final ShopConfiguration shopConfiguration) {
    return ZoneId.of(shopConfiguration.timeZone());
  }

  /**
   * Executor for searches, shut down with the server.
   *
   * @param environment the environment
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(SearchManager.SEARCH_EXECUTOR)
  ExecutorService searchExecutor(final Environment environment) {
    return environment.lifecycle().executorService("search-%d")
        .minThreads(SEARCH_THREADS)
        .maxThreads(SEARCH_THREADS)
        .build();
  }

  /**
   * The interface Binder.
   */
  @Module
  public interface Binder {

    @Binds
    BlobStore blobStore(S3BlobStore blobStore);

    @Binds
    @IntoSet
    HealthCheck dynamoDbHealthCheck(DynamoDbHealthCheck healthCheck);

    @Binds
    @IntoSet
    JerseyResource ticketsResource(TicketsResource resource);

    @Binds
    @IntoSet
    JerseyResource customersResource(CustomersResource resource);

    @Binds
    @IntoSet
    JerseyResource searchResource(SearchResource resource);

    @Binds
    @IntoSet
    JerseyResource attachmentsResource(AttachmentsResource resource);

    @Binds
    @IntoSet
    JerseyResource migrationResource(MigrationResource resource);

    @Binds
    @IntoSet
    JerseyResource timeclockResource(TimeclockResource resource);

    @Binds
    @IntoSet
    JerseyResource financialsResource(FinancialsResource resource);

    @Binds
    @IntoSet
    JerseyResource paymentsResource(PaymentsResource resource);

    @Binds
    @IntoSet
    JerseyResource storeSettingsResource(StoreSettingsResource resource);

  }

}
