package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.ImmutableSearchAllResponse;
import com.truetickets.api.v1.model.SearchAllResponse;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.server.exception.InternalException;
import com.truetickets.server.exception.ServiceException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches tickets by subject and customers by name with the same query, side by side.
 */
@Singleton
public class SearchManager {

  /**
   * Name of the executor the searches run on.
   */
  public static final String SEARCH_EXECUTOR = "search";

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchManager.class);

  private final TicketManager ticketManager;
  private final CustomerManager customerManager;
  private final ExecutorService executorService;

  /**
   * Instantiates a new Search manager.
   *
   * @param ticketManager   the ticket manager
   * @param customerManager the customer manager
   * @param executorService the executor service
   */
  @Inject
  public SearchManager(final TicketManager ticketManager,
                       final CustomerManager customerManager,
                       @Named(SEARCH_EXECUTOR) final ExecutorService executorService) {
    LOGGER.info("SearchManager({},{},{})", ticketManager, customerManager, executorService);
    this.ticketManager = ticketManager;
    this.customerManager = customerManager;
    this.executorService = executorService;
  }

  /**
   * Query all search all response.
   *
   * @param query the query
   * @return the search all response
   */
  public SearchAllResponse queryAll(final String query) {
    LOGGER.trace("queryAll({})", query);
    final Future<List<Ticket>> tickets = executorService.submit(() -> ticketManager.bySubject(query));
    final Future<List<Customer>> customers = executorService.submit(() -> customerManager.searchByName(query));
    return ImmutableSearchAllResponse.builder()
        .tickets(await(tickets))
        .customers(await(customers))
        .build();
  }

  private <T> T await(final Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InternalException("Interrupted", "The search was interrupted.", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof ServiceException) {
        throw (ServiceException) e.getCause();
      }
      throw new InternalException("Search Error", "The search failed.", e.getCause());
    }
  }

}
