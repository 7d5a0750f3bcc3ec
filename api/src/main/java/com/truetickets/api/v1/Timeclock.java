package com.truetickets.api.v1;

import com.truetickets.api.v1.model.ClockLogs;
import com.truetickets.api.v1.model.ClockResponse;
import com.truetickets.api.v1.model.ClockStatus;
import com.truetickets.api.v1.model.UpdateClockLogsRequest;
import com.truetickets.api.v1.model.Wage;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * The interface Timeclock. Clocking in and out always applies to the caller.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public interface Timeclock {

  /**
   * Clock in.
   *
   * @param userName the caller
   * @return the clock response
   */
  @POST
  @Path("clock_in")
  ClockResponse clockIn(@HeaderParam(CallerHeaders.USER_NAME) String userName);

  /**
   * Clock out.
   *
   * @param userName the caller
   * @return the clock response
   */
  @POST
  @Path("clock_out")
  ClockResponse clockOut(@HeaderParam(CallerHeaders.USER_NAME) String userName);

  /**
   * Clock status.
   *
   * @param userName the caller
   * @return the clock status
   */
  @GET
  @Path("clock_status")
  ClockStatus clockStatus(@HeaderParam(CallerHeaders.USER_NAME) String userName);

  /**
   * Clock logs of everyone between start and end, with their wages. Managers only.
   *
   * @param userGroups the caller groups
   * @param start      epoch seconds, inclusive
   * @param end        epoch seconds, inclusive
   * @return the clock logs
   */
  @GET
  @Path("clock-logs")
  ClockLogs clockLogs(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                      @QueryParam("start") String start,
                      @QueryParam("end") String end);

  /**
   * Replaces the clock logs of a user for a day. Managers only.
   *
   * @param userGroups the caller groups
   * @param request    the request
   * @return the clock logs of that user for the day after the change
   */
  @POST
  @Path("clock-logs/update")
  @Consumes(MediaType.APPLICATION_JSON)
  ClockLogs updateClockLogs(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                            UpdateClockLogsRequest request);

  /**
   * Wage of a user. Managers only.
   *
   * @param userGroups the caller groups
   * @param userName   the user
   * @return the wage
   */
  @GET
  @Path("wage")
  Wage wage(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
            @QueryParam("user_name") String userName);

  /**
   * Sets the wage of a user. Managers only.
   *
   * @param userGroups the caller groups
   * @param wage       the wage
   * @return the wage
   */
  @POST
  @Path("update-user-wage")
  @Consumes(MediaType.APPLICATION_JSON)
  Wage updateWage(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                  Wage wage);

}
