package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Customers;
import com.truetickets.api.v1.model.CreateCustomerRequest;
import com.truetickets.api.v1.model.CustomerReference;
import com.truetickets.api.v1.model.LastUpdated;
import com.truetickets.api.v1.model.UpdateCustomerRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.CustomerManager;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The customers resource.
 */
@Singleton
public class CustomersResource implements Customers, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(CustomersResource.class);

  private final CustomerManager customerManager;

  /**
   * Instantiates a new Customers resource.
   *
   * @param customerManager the customer manager
   */
  @Inject
  public CustomersResource(final CustomerManager customerManager) {
    LOGGER.info("CustomersResource({})", customerManager);
    this.customerManager = customerManager;
  }

  @Override
  @Timed
  public Response find(final String phoneNumber, final String query, final String id) {
    LOGGER.trace("find({},{},{})", phoneNumber, query, id);
    if (Parameters.countPresent(phoneNumber, query, id) != 1) {
      throw new BadInputException("Invalid Parameters", "Exactly one of phone_number, query or id is required.");
    }
    if (Parameters.present(phoneNumber)) {
      return Response.ok(customerManager.findByPhone(Parameters.required("phone_number", phoneNumber))).build();
    }
    if (Parameters.present(query)) {
      return Response.ok(customerManager.searchByName(query)).build();
    }
    return Response.ok(customerManager.get(Parameters.required("id", id))).build();
  }

  @Override
  @Timed
  public CustomerReference create(final CreateCustomerRequest request) {
    LOGGER.trace("create()");
    return CustomerReference.of(customerManager.create(Parameters.body(request)));
  }

  @Override
  @Timed
  public CustomerReference update(final String customerId, final UpdateCustomerRequest request) {
    LOGGER.trace("update({})", customerId);
    final String id = Parameters.required("customer_id", customerId);
    customerManager.update(id, Parameters.body(request));
    return CustomerReference.of(id);
  }

  @Override
  @Timed
  public LastUpdated lastUpdated(final String customerId) {
    LOGGER.trace("lastUpdated({})", customerId);
    return LastUpdated.of(customerManager.lastUpdated(Parameters.required("customer_id", customerId)));
  }

}
