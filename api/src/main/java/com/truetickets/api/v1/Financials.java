package com.truetickets.api.v1;

import com.truetickets.api.v1.model.MonthPurchases;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.UpdatePurchasesRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.List;

/**
 * The interface Financials. Managers only.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public interface Financials {

  /**
   * Purchases of a month. Empty when nothing was recorded.
   *
   * @param userGroups the caller groups
   * @param year       the year
   * @param month      the month, 1 to 12
   * @return the month purchases
   */
  @GET
  @Path("purchases")
  MonthPurchases purchases(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                           @QueryParam("year") String year,
                           @QueryParam("month") String month);

  /**
   * Replaces the purchases of a month.
   *
   * @param userGroups the caller groups
   * @param year       the year
   * @param month      the month
   * @param request    the request
   * @return the month purchases
   */
  @PUT
  @Path("purchases")
  @Consumes(MediaType.APPLICATION_JSON)
  MonthPurchases updatePurchases(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                                 @QueryParam("year") String year,
                                 @QueryParam("month") String month,
                                 UpdatePurchasesRequest request);

  /**
   * Every ticket paid within the month, with customers.
   *
   * @param userGroups the caller groups
   * @param year       the year
   * @param month      the month
   * @return the list
   */
  @GET
  @Path("all_tickets_for_this_month_with_payments")
  List<Ticket> monthlyRevenue(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                              @QueryParam("year") String year,
                              @QueryParam("month") String month);

}
