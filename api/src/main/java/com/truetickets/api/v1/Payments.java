package com.truetickets.api.v1;

import com.truetickets.api.v1.model.PaymentResult;
import com.truetickets.api.v1.model.TicketReference;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * The interface Payments. The caller is recorded as the tech on the receipt comment.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public interface Payments {

  /**
   * Charges the line items plus tax and resolves the ticket.
   *
   * @param userName     the caller
   * @param ticketNumber the ticket number
   * @return the ticket and the amount charged
   */
  @POST
  @Path("take_payment")
  PaymentResult takePayment(@HeaderParam(CallerHeaders.USER_NAME) String userName,
                            @QueryParam("ticket_number") String ticketNumber);

  /**
   * Reverts a payment, the ticket goes back in progress. Managers only.
   *
   * @param userName     the caller
   * @param userGroups   the caller groups
   * @param ticketNumber the ticket number
   * @return the ticket reference
   */
  @POST
  @Path("refund_payment")
  TicketReference refundPayment(@HeaderParam(CallerHeaders.USER_NAME) String userName,
                                @HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                                @QueryParam("ticket_number") String ticketNumber);

  /**
   * The customer declined the repair. The ticket is ready for pickup with nothing charged.
   *
   * @param userName     the caller
   * @param ticketNumber the ticket number
   * @return the ticket reference
   */
  @POST
  @Path("dont_fix")
  TicketReference declineRepair(@HeaderParam(CallerHeaders.USER_NAME) String userName,
                                @QueryParam("ticket_number") String ticketNumber);

}
