package com.truetickets.tickets.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.model.UpstreamConfiguration;
import com.truetickets.tickets.model.UpstreamTicket;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tickets from the legacy RepairShopr api. Every failure is an {@link InternalException}, which stops the
 * migration batch.
 */
@Singleton
public class RepairShoprClient {

  /**
   * Name of the jersey client used upstream.
   */
  public static final String UPSTREAM_CLIENT = "upstream";

  private static final Logger LOGGER = LoggerFactory.getLogger(RepairShoprClient.class);
  private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
      + "(KHTML, like Gecko) Chrome/140.0.0.0 Safari/537.36";

  private final Client client;
  private final UpstreamConfiguration configuration;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Repair shopr client.
   *
   * @param client        the client
   * @param configuration the configuration
   * @param objectMapper  the object mapper
   */
  @Inject
  public RepairShoprClient(@Named(UPSTREAM_CLIENT) final Client client,
                           final UpstreamConfiguration configuration,
                           final ObjectMapper objectMapper) {
    LOGGER.info("RepairShoprClient({})", configuration);
    this.client = client;
    this.configuration = configuration;
    this.objectMapper = objectMapper;
  }

  /**
   * The legacy internal id of the ticket with the number.
   *
   * @param ticketNumber the ticket number
   * @return the long
   */
  public long findTicketId(final long ticketNumber) {
    LOGGER.trace("findTicketId({})", ticketNumber);
    final JsonNode root = getJson(api().path("tickets").queryParam("number", ticketNumber).request(),
        "ticket " + ticketNumber);
    final JsonNode id = root.path("tickets").path(0).path("id");
    if (!id.canConvertToLong()) {
      throw new InternalException("Upstream Error", "No upstream ticket with number " + ticketNumber + ".");
    }
    return id.asLong();
  }

  /**
   * The ticket with the legacy internal id.
   *
   * @param ticketId the ticket id
   * @return the upstream ticket
   */
  public UpstreamTicket fetchTicket(final long ticketId) {
    LOGGER.trace("fetchTicket({})", ticketId);
    final JsonNode root = getJson(api().path("tickets").path(Long.toString(ticketId)).request(),
        "ticket id " + ticketId);
    final JsonNode ticket = root.get("ticket");
    if (ticket == null || !ticket.isObject()) {
      throw new InternalException("Upstream Error", "Response for ticket id " + ticketId + " has no ticket.");
    }
    try {
      return objectMapper.treeToValue(ticket, UpstreamTicket.class);
    } catch (JsonProcessingException e) {
      throw new InternalException("Deserialization Error", "Could not read upstream ticket id " + ticketId + ".", e);
    }
  }

  /**
   * Downloads the file.
   *
   * @param url the url
   * @return the bytes
   */
  public byte[] download(final String url) {
    LOGGER.trace("download({})", url);
    try (Response response = client.target(url).request().header(HttpHeaders.USER_AGENT, USER_AGENT).get()) {
      if (response.getStatusInfo().getFamily() != Response.Status.Family.SUCCESSFUL) {
        throw new InternalException("Download Failed", "Status " + response.getStatus() + " downloading " + url);
      }
      return response.readEntity(byte[].class);
    } catch (ProcessingException e) {
      throw new InternalException("Download Failed", "Could not download " + url, e);
    }
  }

  private WebTarget api() {
    return client.target(configuration.baseUrl());
  }

  private JsonNode getJson(final Invocation.Builder builder, final String what) {
    try (Response response = builder
        .accept(MediaType.APPLICATION_JSON_TYPE)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + configuration.apiKey())
        .header(HttpHeaders.USER_AGENT, USER_AGENT)
        .get()) {
      if (response.getStatusInfo().getFamily() != Response.Status.Family.SUCCESSFUL) {
        LOGGER.warn("getJson({}): status {}", what, response.getStatus());
        throw new InternalException("Upstream Error", "Upstream returned status " + response.getStatus()
            + " for " + what + ".");
      }
      return response.readEntity(JsonNode.class);
    } catch (ProcessingException e) {
      throw new InternalException("Upstream Error", "Could not read " + what + " from upstream.", e);
    }
  }

}
