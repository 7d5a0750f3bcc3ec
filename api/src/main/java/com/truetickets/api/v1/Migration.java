package com.truetickets.api.v1;

import com.truetickets.api.v1.model.MigrationResult;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * The interface Migration.
 */
@Path("/migrate-tickets")
@Produces(MediaType.APPLICATION_JSON)
public interface Migration {

  /**
   * Imports the tickets latest, latest - 1, ... from the legacy system. Requires an owner.
   *
   * @param userGroups         the caller groups
   * @param latestTicketNumber the highest upstream ticket number of the batch
   * @param count              how many tickets, at most 5
   * @return the migration result
   */
  @GET
  MigrationResult migrate(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                          @QueryParam("latest_ticket_number") String latestTicketNumber,
                          @QueryParam("count") String count);

}
