package com.truetickets.api.v1;

import com.truetickets.api.v1.model.SearchAllResponse;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Searches tickets by subject and customers by name at the same time.
 */
@Path("/query_all")
@Produces(MediaType.APPLICATION_JSON)
public interface Search {

  @GET
  SearchAllResponse queryAll(@QueryParam("query") String query);

}
