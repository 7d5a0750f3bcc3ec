package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.StoreSettings;
import com.truetickets.api.v1.model.ImmutableStoreConfigResponse;
import com.truetickets.api.v1.model.StoreConfig;
import com.truetickets.api.v1.model.StoreConfigResponse;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.RoleManager;
import com.truetickets.tickets.manager.StoreConfigManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The store settings resource. Anyone may read them, owners change them.
 */
@Singleton
public class StoreSettingsResource implements StoreSettings, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(StoreSettingsResource.class);

  private final StoreConfigManager storeConfigManager;
  private final RoleManager roleManager;

  /**
   * Instantiates a new Store settings resource.
   *
   * @param storeConfigManager the store config manager
   * @param roleManager        the role manager
   */
  @Inject
  public StoreSettingsResource(final StoreConfigManager storeConfigManager,
                               final RoleManager roleManager) {
    LOGGER.info("StoreSettingsResource({},{})", storeConfigManager, roleManager);
    this.storeConfigManager = storeConfigManager;
    this.roleManager = roleManager;
  }

  @Override
  @Timed
  public StoreConfigResponse read() {
    LOGGER.trace("read()");
    return ImmutableStoreConfigResponse.builder().config(storeConfigManager.get()).build();
  }

  @Override
  @Timed
  public StoreConfigResponse update(final String userGroups, final StoreConfig config) {
    LOGGER.trace("update()");
    roleManager.requireOwner(userGroups);
    return ImmutableStoreConfigResponse.builder().config(storeConfigManager.put(Parameters.body(config))).build();
  }

}
