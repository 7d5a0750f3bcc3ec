package com.truetickets.tickets.migration;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.ImmutableMigrationResult;
import com.truetickets.api.v1.model.MigrationResult;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.blob.BlobStore;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.manager.AttachmentManager;
import com.truetickets.tickets.manager.CustomerManager;
import com.truetickets.tickets.manager.IdentifierManager;
import com.truetickets.tickets.manager.IndexManager;
import com.truetickets.tickets.model.UpstreamAttachment;
import com.truetickets.tickets.model.UpstreamTicket;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;

/**
 * Copies tickets from the legacy system. Each ticket is written with its customer in one transaction, so a failed
 * batch leaves whole tickets behind and can be rerun.
 */
@Singleton
public class MigrationManager {

  /**
   * Most tickets a batch may migrate.
   */
  public static final int MAX_COUNT = 5;

  private static final Logger LOGGER = LoggerFactory.getLogger(MigrationManager.class);
  private static final int ID_LENGTH = 4;

  private final RepairShoprClient repairShoprClient;
  private final LegacyTicketNormalizer normalizer;
  private final BlobStore blobStore;
  private final DynamoDbStore dynamoDbStore;
  private final IndexManager indexManager;
  private final IdentifierManager identifierManager;
  private final CustomerManager customerManager;
  private final Clock clock;

  /**
   * Instantiates a new Migration manager.
   *
   * @param repairShoprClient the repair shopr client
   * @param normalizer        the normalizer
   * @param blobStore         the blob store
   * @param dynamoDbStore     the dynamo db store
   * @param indexManager      the index manager
   * @param identifierManager the identifier manager
   * @param customerManager   the customer manager
   * @param clock             the clock
   */
  @Inject
  public MigrationManager(final RepairShoprClient repairShoprClient,
                          final LegacyTicketNormalizer normalizer,
                          final BlobStore blobStore,
                          final DynamoDbStore dynamoDbStore,
                          final IndexManager indexManager,
                          final IdentifierManager identifierManager,
                          final CustomerManager customerManager,
                          final Clock clock) {
    LOGGER.info("MigrationManager({},{},{})", repairShoprClient, blobStore, dynamoDbStore);
    this.repairShoprClient = repairShoprClient;
    this.normalizer = normalizer;
    this.blobStore = blobStore;
    this.dynamoDbStore = dynamoDbStore;
    this.indexManager = indexManager;
    this.identifierManager = identifierManager;
    this.customerManager = customerManager;
    this.clock = clock;
  }

  /**
   * Migrate the count tickets ending at the latest number, newest first, then move the ticket counter up to the
   * latest number so new tickets do not collide with migrated ones.
   *
   * @param latestTicketNumber the latest ticket number
   * @param count              the count
   * @return the migration result
   */
  public MigrationResult migrate(final long latestTicketNumber, final int count) {
    LOGGER.trace("migrate({},{})", latestTicketNumber, count);
    if (count < 1 || count > MAX_COUNT) {
      throw new BadInputException("Invalid Parameter", "count must be between 1 and " + MAX_COUNT + ".");
    }
    if (latestTicketNumber < count) {
      throw new BadInputException("Invalid Parameter", "latest_ticket_number must be at least count.");
    }
    int migrated = 0;
    for (int i = 0; i < count; i++) {
      migrateOne(latestTicketNumber - i);
      migrated++;
    }
    identifierManager.raiseTicketNumber(latestTicketNumber);
    LOGGER.info("migrate(): {} tickets up to {}", migrated, latestTicketNumber);
    return ImmutableMigrationResult.builder()
        .migratedCount(migrated)
        .highestTicketNumber(latestTicketNumber)
        .build();
  }

  private void migrateOne(final long ticketNumber) {
    final UpstreamTicket upstream = repairShoprClient.fetchTicket(repairShoprClient.findTicketId(ticketNumber));
    if (upstream.number() != ticketNumber) {
      throw new InternalException("Upstream Error", "Asked upstream for ticket " + ticketNumber
          + " and got " + upstream.number() + ".");
    }
    final Customer customer = normalizer.customer(upstream);
    final List<String> attachments = new ArrayList<>();
    for (UpstreamAttachment attachment : upstream.attachments()) {
      attachments.add(copy(ticketNumber, attachment));
    }
    final Ticket ticket = normalizer.ticket(upstream, attachments);
    final List<PhoneNumber> previousPhones = customerManager.phoneNumbers(customer.customerId()).orElse(List.of());
    final List<TransactWriteItem> items = new ArrayList<>(indexManager.customerUpsert(customer, previousPhones));
    items.addAll(indexManager.ticketUpsert(ticket));
    dynamoDbStore.transactWrite(items);
    LOGGER.debug("migrateOne({}): customer {}, {} attachments", ticketNumber, customer.customerId(),
        attachments.size());
  }

  private String copy(final long ticketNumber, final UpstreamAttachment attachment) {
    final byte[] bytes = repairShoprClient.download(LegacyTicketNormalizer.unescape(attachment.file().url()));
    final String key = AttachmentManager.key(ticketNumber, clock.instant().getEpochSecond(),
        identifierManager.shortId(ID_LENGTH), Optional.empty());
    return blobStore.put(key, bytes, AttachmentManager.DEFAULT_CONTENT_TYPE);
  }

}
