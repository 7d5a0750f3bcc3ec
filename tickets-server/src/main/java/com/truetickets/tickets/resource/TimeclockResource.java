package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Timeclock;
import com.truetickets.api.v1.model.ClockLogs;
import com.truetickets.api.v1.model.ClockResponse;
import com.truetickets.api.v1.model.ClockStatus;
import com.truetickets.api.v1.model.UpdateClockLogsRequest;
import com.truetickets.api.v1.model.Wage;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.ClockManager;
import com.truetickets.tickets.manager.RoleManager;
import com.truetickets.tickets.manager.WageManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clocking in and out for everyone, the logs and wages for managers.
 */
@Singleton
public class TimeclockResource implements Timeclock, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeclockResource.class);

  private final ClockManager clockManager;
  private final WageManager wageManager;
  private final RoleManager roleManager;

  /**
   * Instantiates a new Timeclock resource.
   *
   * @param clockManager the clock manager
   * @param wageManager  the wage manager
   * @param roleManager  the role manager
   */
  @Inject
  public TimeclockResource(final ClockManager clockManager,
                           final WageManager wageManager,
                           final RoleManager roleManager) {
    LOGGER.info("TimeclockResource({},{},{})", clockManager, wageManager, roleManager);
    this.clockManager = clockManager;
    this.wageManager = wageManager;
    this.roleManager = roleManager;
  }

  @Override
  @Timed
  public ClockResponse clockIn(final String userName) {
    LOGGER.trace("clockIn({})", userName);
    return clockManager.clock(roleManager.requireUser(userName), true);
  }

  @Override
  @Timed
  public ClockResponse clockOut(final String userName) {
    LOGGER.trace("clockOut({})", userName);
    return clockManager.clock(roleManager.requireUser(userName), false);
  }

  @Override
  @Timed
  public ClockStatus clockStatus(final String userName) {
    LOGGER.trace("clockStatus({})", userName);
    return clockManager.status(roleManager.requireUser(userName));
  }

  @Override
  @Timed
  public ClockLogs clockLogs(final String userGroups, final String start, final String end) {
    LOGGER.trace("clockLogs({},{})", start, end);
    roleManager.requireManager(userGroups);
    return clockManager.logs(Parameters.requiredLong("start", start), Parameters.requiredLong("end", end));
  }

  @Override
  @Timed
  public ClockLogs updateClockLogs(final String userGroups, final UpdateClockLogsRequest request) {
    LOGGER.trace("updateClockLogs()");
    roleManager.requireManager(userGroups);
    return clockManager.updateLogs(Parameters.body(request));
  }

  @Override
  @Timed
  public Wage wage(final String userGroups, final String userName) {
    LOGGER.trace("wage({})", userName);
    roleManager.requireManager(userGroups);
    return wageManager.get(Parameters.required("user_name", userName));
  }

  @Override
  @Timed
  public Wage updateWage(final String userGroups, final Wage wage) {
    LOGGER.trace("updateWage()");
    roleManager.requireManager(userGroups);
    return wageManager.set(Parameters.body(wage));
  }

}
