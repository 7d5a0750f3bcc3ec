package com.truetickets.api.v1;

import com.truetickets.api.v1.model.CommentRequest;
import com.truetickets.api.v1.model.CreateTicketRequest;
import com.truetickets.api.v1.model.LastUpdated;
import com.truetickets.api.v1.model.TicketReference;
import com.truetickets.api.v1.model.UpdateTicketRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * The interface Tickets.
 */
@Path("/tickets")
@Produces(MediaType.APPLICATION_JSON)
public interface Tickets {

  /**
   * Finds tickets. Exactly one selector must be present: number, ticket_number_last_3_digits,
   * subject_query, customer_id or get_recent. Device and status (separated by '|') are only
   * allowed with get_recent.
   *
   * @param number         a ticket number, returns one ticket.
   * @param lastDigits     the last digits of a ticket number, returns a list.
   * @param subjectQuery   words that must all be in the subject, returns a list.
   * @param customerId     the customer whose tickets are returned.
   * @param getRecent      present to list the most recent tickets.
   * @param device         optional device filter for recent tickets.
   * @param status         optional status filter for recent tickets.
   * @return the response holding a ticket or a list of tickets.
   */
  @GET
  Response find(@QueryParam("number") String number,
                @QueryParam("ticket_number_last_3_digits") String lastDigits,
                @QueryParam("subject_query") String subjectQuery,
                @QueryParam("customer_id") String customerId,
                @QueryParam("get_recent") String getRecent,
                @QueryParam("device") String device,
                @QueryParam("status") String status);

  /**
   * Create a ticket. The number is assigned by the server and the ticket starts out diagnosing.
   *
   * @param request the request
   * @return the ticket reference
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  TicketReference create(CreateTicketRequest request);

  /**
   * Update ticket reference.
   *
   * @param number  the number
   * @param request the request
   * @return the ticket reference
   */
  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  TicketReference update(@QueryParam("number") String number,
                         UpdateTicketRequest request);

  /**
   * Add comment ticket reference.
   *
   * @param ticketNumber the ticket number
   * @param request      the request
   * @return the ticket reference
   */
  @POST
  @Path("/comment")
  @Consumes(MediaType.APPLICATION_JSON)
  TicketReference addComment(@QueryParam("ticket_number") String ticketNumber,
                             CommentRequest request);

  /**
   * Last updated.
   *
   * @param number the number
   * @return the last updated
   */
  @GET
  @Path("/last_updated")
  LastUpdated lastUpdated(@QueryParam("number") String number);

}
