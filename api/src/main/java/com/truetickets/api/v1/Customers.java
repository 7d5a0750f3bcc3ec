package com.truetickets.api.v1;

import com.truetickets.api.v1.model.CreateCustomerRequest;
import com.truetickets.api.v1.model.CustomerReference;
import com.truetickets.api.v1.model.LastUpdated;
import com.truetickets.api.v1.model.UpdateCustomerRequest;
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
 * The interface Customers.
 */
@Path("/customers")
@Produces(MediaType.APPLICATION_JSON)
public interface Customers {

  /**
   * Finds customers by exactly one of phone number, name query or id.
   *
   * @param phoneNumber the exact phone number, returns a list.
   * @param query       words that must all be in the name, returns a list.
   * @param id          the customer id, returns one customer.
   * @return the response
   */
  @GET
  Response find(@QueryParam("phone_number") String phoneNumber,
                @QueryParam("query") String query,
                @QueryParam("id") String id);

  /**
   * Create customer reference.
   *
   * @param request the request
   * @return the customer reference
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  CustomerReference create(CreateCustomerRequest request);

  /**
   * Update customer reference.
   *
   * @param customerId the customer id
   * @param request    the request
   * @return the customer reference
   */
  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  CustomerReference update(@QueryParam("customer_id") String customerId,
                           UpdateCustomerRequest request);

  /**
   * Last updated.
   *
   * @param customerId the customer id
   * @return the last updated
   */
  @GET
  @Path("/last_updated")
  LastUpdated lastUpdated(@QueryParam("customer_id") String customerId);

}
