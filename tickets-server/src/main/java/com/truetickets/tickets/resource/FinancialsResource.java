package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Financials;
import com.truetickets.api.v1.model.MonthPurchases;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.UpdatePurchasesRequest;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.FinancialsManager;
import com.truetickets.tickets.manager.RoleManager;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monthly revenue and purchases, for managers.
 */
@Singleton
public class FinancialsResource implements Financials, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(FinancialsResource.class);

  private final FinancialsManager financialsManager;
  private final RoleManager roleManager;

  /**
   * Instantiates a new Financials resource.
   *
   * @param financialsManager the financials manager
   * @param roleManager       the role manager
   */
  @Inject
  public FinancialsResource(final FinancialsManager financialsManager,
                            final RoleManager roleManager) {
    LOGGER.info("FinancialsResource({},{})", financialsManager, roleManager);
    this.financialsManager = financialsManager;
    this.roleManager = roleManager;
  }

  @Override
  @Timed
  public MonthPurchases purchases(final String userGroups, final String year, final String month) {
    LOGGER.trace("purchases({},{})", year, month);
    roleManager.requireManager(userGroups);
    return financialsManager.purchases(Parameters.requiredInt("year", year), Parameters.requiredInt("month", month));
  }

  @Override
  @Timed
  public MonthPurchases updatePurchases(final String userGroups,
                                        final String year,
                                        final String month,
                                        final UpdatePurchasesRequest request) {
    LOGGER.trace("updatePurchases({},{})", year, month);
    roleManager.requireManager(userGroups);
    return financialsManager.updatePurchases(Parameters.requiredInt("year", year),
        Parameters.requiredInt("month", month), Parameters.body(request));
  }

  @Override
  @Timed
  public List<Ticket> monthlyRevenue(final String userGroups, final String year, final String month) {
    LOGGER.trace("monthlyRevenue({},{})", year, month);
    roleManager.requireManager(userGroups);
    return financialsManager.monthlyRevenue(Parameters.requiredInt("year", year),
        Parameters.requiredInt("month", month));
  }

}
