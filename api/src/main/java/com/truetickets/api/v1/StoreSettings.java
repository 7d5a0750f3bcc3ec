package com.truetickets.api.v1;

import com.truetickets.api.v1.model.StoreConfig;
import com.truetickets.api.v1.model.StoreConfigResponse;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * The interface Store settings.
 */
@Path("/store_config")
@Produces(MediaType.APPLICATION_JSON)
public interface StoreSettings {

  @GET
  StoreConfigResponse read();

  /**
   * Replaces the store config. Owners only.
   *
   * @param userGroups the caller groups
   * @param config     the config
   * @return the store config response
   */
  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  StoreConfigResponse update(@HeaderParam(CallerHeaders.USER_GROUPS) String userGroups,
                             StoreConfig config);

}
