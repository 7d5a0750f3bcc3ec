package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Tickets;
import com.truetickets.api.v1.model.CommentRequest;
import com.truetickets.api.v1.model.CreateTicketRequest;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.LastUpdated;
import com.truetickets.api.v1.model.TicketReference;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.api.v1.model.UpdateTicketRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.TicketManager;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tickets resource.
 */
@Singleton
public class TicketsResource implements Tickets, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(TicketsResource.class);

  private final TicketManager ticketManager;

  /**
   * Instantiates a new Tickets resource.
   *
   * @param ticketManager the ticket manager
   */
  @Inject
  public TicketsResource(final TicketManager ticketManager) {
    LOGGER.info("TicketsResource({})", ticketManager);
    this.ticketManager = ticketManager;
  }

  @Override
  @Timed
  public Response find(final String number,
                       final String lastDigits,
                       final String subjectQuery,
                       final String customerId,
                       final String getRecent,
                       final String device,
                       final String status) {
    LOGGER.trace("find({},{},{},{},{},{},{})", number, lastDigits, subjectQuery, customerId, getRecent, device,
        status);
    if (Parameters.countPresent(number, lastDigits, subjectQuery, customerId, getRecent) != 1) {
      throw new BadInputException("Invalid Parameters",
          "Exactly one of number, ticket_number_last_3_digits, subject_query, customer_id or get_recent is required.");
    }
    if (!Parameters.present(getRecent) && Parameters.countPresent(device, status) > 0) {
      throw new BadInputException("Invalid Parameters", "device and status are only allowed with get_recent.");
    }
    if (Parameters.present(number)) {
      return Response.ok(ticketManager.get(Parameters.requiredLong("number", number))).build();
    }
    if (Parameters.present(lastDigits)) {
      return Response.ok(ticketManager.bySuffix(suffix(lastDigits))).build();
    }
    if (Parameters.present(subjectQuery)) {
      return Response.ok(ticketManager.bySubject(subjectQuery)).build();
    }
    if (Parameters.present(customerId)) {
      return Response.ok(ticketManager.byCustomer(Parameters.required("customer_id", customerId))).build();
    }
    return Response.ok(ticketManager.recent(device(device), statuses(status))).build();
  }

  @Override
  @Timed
  public TicketReference create(final CreateTicketRequest request) {
    LOGGER.trace("create()");
    return TicketReference.of(ticketManager.create(Parameters.body(request)));
  }

  @Override
  @Timed
  public TicketReference update(final String number, final UpdateTicketRequest request) {
    LOGGER.trace("update({})", number);
    final long ticketNumber = Parameters.requiredLong("number", number);
    ticketManager.update(ticketNumber, Parameters.body(request));
    return TicketReference.of(ticketNumber);
  }

  @Override
  @Timed
  public TicketReference addComment(final String ticketNumber, final CommentRequest request) {
    LOGGER.trace("addComment({})", ticketNumber);
    final long number = Parameters.requiredLong("ticket_number", ticketNumber);
    ticketManager.addComment(number, Parameters.body(request));
    return TicketReference.of(number);
  }

  @Override
  @Timed
  public LastUpdated lastUpdated(final String number) {
    LOGGER.trace("lastUpdated({})", number);
    return LastUpdated.of(ticketManager.lastUpdated(Parameters.requiredLong("number", number)));
  }

  private int suffix(final String lastDigits) {
    final String digits = Parameters.required("ticket_number_last_3_digits", lastDigits);
    if (!digits.matches("\\d{1,3}")) {
      throw new BadInputException("Invalid Parameter", "ticket_number_last_3_digits must be 1 to 3 digits.");
    }
    return Integer.parseInt(digits);
  }

  private Optional<Device> device(final String device) {
    if (device == null || device.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Device.find(device.trim())
        .orElseThrow(() -> new BadInputException("Invalid Parameter", "Unknown device '" + device + "'.")));
  }

  private List<TicketStatus> statuses(final String status) {
    if (status == null || status.isBlank()) {
      return List.of();
    }
    return Arrays.stream(status.split("\\|"))
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .map(name -> TicketStatus.find(name)
            .orElseThrow(() -> new BadInputException("Invalid Parameter", "Unknown status '" + name + "'.")))
        .distinct()
        .toList();
  }

}
