package com.truetickets.server.resource;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.UriInfo;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.glassfish.jersey.server.internal.routing.UriRoutingContext;
import org.glassfish.jersey.uri.UriTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Gives every request a trace id in the logging context, and logs how each request ended.
 */
@Singleton
public class RequestTraceFilter implements ContainerRequestFilter, ContainerResponseFilter, JerseyResource {

  /**
   * The MDC key holding the trace id.
   */
  public static final String TRACE = "trace";

  private static final Logger LOGGER = LoggerFactory.getLogger(RequestTraceFilter.class);
  private static final String START_PROPERTY = RequestTraceFilter.class.getName() + ".start";

  private final Clock clock;

  /**
   * Default constructor.
   *
   * @param clock to time the requests.
   */
  @Inject
  public RequestTraceFilter(final Clock clock) {
    this.clock = clock;
    LOGGER.info("RequestTraceFilter({})", clock);
  }

  private Optional<UriRoutingContext> uriRoutingContext(final ContainerRequestContext requestContext) {
    final UriInfo uriInfo = requestContext.getUriInfo();
    if (!(uriInfo instanceof UriRoutingContext)) {
      LOGGER.warn("Not a URI routing context: {}:{}", requestContext.getMethod(), requestContext.getUriInfo().getPath());
      return Optional.empty();
    }
    return Optional.of((UriRoutingContext) requestContext.getUriInfo());
  }

  private String endpoint(final UriRoutingContext uriRoutingContext) {
    final List<UriTemplate> templates = uriRoutingContext.getMatchedTemplates();
    if (templates.isEmpty()) {
      return "unknown";
    } else {
      return templates.get(templates.size() - 1).getTemplate();
    }
  }

  /**
   * Sets the trace id.
   *
   * @param requestContext request context.
   * @throws IOException if anything goes wrong.
   */
  @Override
  public void filter(final ContainerRequestContext requestContext) throws IOException {
    MDC.put(TRACE, UUID.randomUUID().toString());
    requestContext.setProperty(START_PROPERTY, clock.millis());
    LOGGER.trace("RequestTraceFilter.filter start:{}", requestContext.getUriInfo().getPath());
  }

  /**
   * Logs the outcome and clears the trace id.
   *
   * @param requestContext  request context.
   * @param responseContext response context.
   * @throws IOException if anything goes wrong.
   */
  @Override
  public void filter(final ContainerRequestContext requestContext,
                     final ContainerResponseContext responseContext) throws IOException {
    final Object start = requestContext.getProperty(START_PROPERTY);
    if (start == null) {
      // Happens when no resource matched, the request filter never ran.
      LOGGER.debug("No trace for path:{}", requestContext.getUriInfo().getPath());
    } else {
      final String endpoint = uriRoutingContext(requestContext)
          .map(this::endpoint)
          .orElse("unknown");
      LOGGER.info("{} {} -> {} ({}ms)", requestContext.getMethod(), endpoint,
          responseContext.getStatus(), clock.millis() - (Long) start);
    }
    MDC.clear();
  }
}
