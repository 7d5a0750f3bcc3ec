package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Payments;
import com.truetickets.api.v1.model.PaymentResult;
import com.truetickets.api.v1.model.TicketReference;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.PaymentManager;
import com.truetickets.tickets.manager.RoleManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The payments resource.
 */
@Singleton
public class PaymentsResource implements Payments, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaymentsResource.class);

  private final PaymentManager paymentManager;
  private final RoleManager roleManager;

  /**
   * Instantiates a new Payments resource.
   *
   * @param paymentManager the payment manager
   * @param roleManager    the role manager
   */
  @Inject
  public PaymentsResource(final PaymentManager paymentManager,
                          final RoleManager roleManager) {
    LOGGER.info("PaymentsResource({},{})", paymentManager, roleManager);
    this.paymentManager = paymentManager;
    this.roleManager = roleManager;
  }

  @Override
  @Timed
  public PaymentResult takePayment(final String userName, final String ticketNumber) {
    LOGGER.trace("takePayment({},{})", userName, ticketNumber);
    final String tech = roleManager.requireUser(userName);
    final long number = Parameters.requiredLong("ticket_number", ticketNumber);
    return PaymentResult.of(number, paymentManager.takePayment(number, tech));
  }

  @Override
  @Timed
  public TicketReference refundPayment(final String userName, final String userGroups, final String ticketNumber) {
    LOGGER.trace("refundPayment({},{})", userName, ticketNumber);
    roleManager.requireManager(userGroups);
    final String tech = roleManager.requireUser(userName);
    final long number = Parameters.requiredLong("ticket_number", ticketNumber);
    paymentManager.refundPayment(number, tech);
    return TicketReference.of(number);
  }

  @Override
  @Timed
  public TicketReference declineRepair(final String userName, final String ticketNumber) {
    LOGGER.trace("declineRepair({},{})", userName, ticketNumber);
    final String tech = roleManager.requireUser(userName);
    final long number = Parameters.requiredLong("ticket_number", ticketNumber);
    paymentManager.declineRepair(number, tech);
    return TicketReference.of(number);
  }

}
