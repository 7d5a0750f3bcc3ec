package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Search;
import com.truetickets.api.v1.model.SearchAllResponse;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.SearchManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The search resource.
 */
@Singleton
public class SearchResource implements Search, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchResource.class);

  private final SearchManager searchManager;

  /**
   * Instantiates a new Search resource.
   *
   * @param searchManager the search manager
   */
  @Inject
  public SearchResource(final SearchManager searchManager) {
    LOGGER.info("SearchResource({})", searchManager);
    this.searchManager = searchManager;
  }

  @Override
  @Timed
  public SearchAllResponse queryAll(final String query) {
    LOGGER.trace("queryAll({})", query);
    return searchManager.queryAll(Parameters.required("query", query));
  }

}
