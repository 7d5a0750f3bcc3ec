package com.truetickets.tickets.manager;

import com.truetickets.server.exception.ForbiddenException;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the caller's groups as passed on by the gateway. The gateway has already authenticated the caller, this only
 * decides if the groups are enough for the operation.
 */
@Singleton
public class RoleManager {

  public static final String ADMIN = "TrueTickets-Cacell-ApplicationAdmin";
  public static final String OWNER = "TrueTickets-Cacell-Owner";
  public static final String MANAGER = "TrueTickets-Cacell-Manager";
  public static final String EMPLOYEE = "TrueTickets-Cacell-Employee";

  private static final Logger LOGGER = LoggerFactory.getLogger(RoleManager.class);
  private static final Set<String> OWNER_GROUPS = Set.of(ADMIN, OWNER);
  private static final Set<String> MANAGER_GROUPS = Set.of(ADMIN, OWNER, MANAGER);

  /**
   * Instantiates a new Role manager.
   */
  @Inject
  public RoleManager() {
    LOGGER.info("RoleManager()");
  }

  /**
   * The caller's name, required for operations done as the caller.
   *
   * @param userName the user name header
   * @return the string
   */
  public String requireUser(final String userName) {
    if (userName == null || userName.isBlank()) {
      throw new ForbiddenException("Forbidden", "No user name was given for this request.");
    }
    return userName.trim();
  }

  /**
   * Requires a manager, owner or admin.
   *
   * @param groups the groups header
   */
  public void requireManager(final String groups) {
    require(groups, MANAGER_GROUPS, "Manager");
  }

  /**
   * Requires an owner or admin.
   *
   * @param groups the groups header
   */
  public void requireOwner(final String groups) {
    require(groups, OWNER_GROUPS, "Owner");
  }

  /**
   * Groups from the comma separated header.
   *
   * @param groups the groups header, nullable
   * @return the list
   */
  public List<String> groups(final String groups) {
    if (groups == null || groups.isBlank()) {
      return List.of();
    }
    return Arrays.stream(groups.split(","))
        .map(String::trim)
        .filter(group -> !group.isEmpty())
        .toList();
  }

  private void require(final String groups, final Set<String> allowed, final String role) {
    final List<String> callerGroups = groups(groups);
    if (callerGroups.stream().noneMatch(allowed::contains)) {
      LOGGER.debug("require({}): denied for {}", role, callerGroups);
      throw new ForbiddenException("Forbidden", "This requires the " + role + " role or higher.");
    }
  }

}
