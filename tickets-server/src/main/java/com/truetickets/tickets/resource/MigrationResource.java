package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Migration;
import com.truetickets.api.v1.model.MigrationResult;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.RoleManager;
import com.truetickets.tickets.migration.MigrationManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owners start migration batches here.
 */
@Singleton
public class MigrationResource implements Migration, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(MigrationResource.class);

  private final MigrationManager migrationManager;
  private final RoleManager roleManager;

  /**
   * Instantiates a new Migration resource.
   *
   * @param migrationManager the migration manager
   * @param roleManager      the role manager
   */
  @Inject
  public MigrationResource(final MigrationManager migrationManager,
                           final RoleManager roleManager) {
    LOGGER.info("MigrationResource({},{})", migrationManager, roleManager);
    this.migrationManager = migrationManager;
    this.roleManager = roleManager;
  }

  @Override
  @Timed
  public MigrationResult migrate(final String userGroups, final String latestTicketNumber, final String count) {
    LOGGER.trace("migrate({},{})", latestTicketNumber, count);
    roleManager.requireOwner(userGroups);
    return migrationManager.migrate(
        Parameters.requiredLong("latest_ticket_number", latestTicketNumber),
        Parameters.requiredInt("count", count));
  }

}
