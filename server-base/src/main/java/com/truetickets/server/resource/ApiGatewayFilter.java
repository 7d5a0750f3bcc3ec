package com.truetickets.server.resource;

import jakarta.annotation.Priority;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes the server behave the way clients behind the API gateway expect. The deployment stage prefix is removed from
 * the path before matching, preflight requests are answered here, and every response allows any origin.
 */
@Singleton
@PreMatching
@Priority(Priorities.HEADER_DECORATOR)
public class ApiGatewayFilter implements ContainerRequestFilter, ContainerResponseFilter, JerseyResource {

  /**
   * The constant ALLOW_ORIGIN.
   */
  public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
  /**
   * The constant ALLOW_METHODS.
   */
  public static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
  /**
   * The constant ALLOW_HEADERS.
   */
  public static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
  /**
   * The constant MAX_AGE.
   */
  public static final String MAX_AGE = "Access-Control-Max-Age";

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiGatewayFilter.class);
  private static final List<String> STAGE_PREFIXES = List.of("Prod", "prod");
  private static final String METHODS = "GET,POST,PUT,DELETE,OPTIONS";
  private static final String HEADERS =
      "Content-Type,X-Amz-Date,Authorization,X-Api-Key,X-Amz-Security-Token,If-Modified-Since";
  private static final String ONE_DAY = "86400";

  /**
   * Instantiates a new Api gateway filter.
   */
  @Inject
  public ApiGatewayFilter() {
    LOGGER.info("ApiGatewayFilter()");
  }

  @Override
  public void filter(final ContainerRequestContext requestContext) throws IOException {
    stripStagePrefix(requestContext);
    if (HttpMethod.OPTIONS.equals(requestContext.getMethod())) {
      LOGGER.trace("preflight: {}", requestContext.getUriInfo().getPath());
      requestContext.abortWith(Response.ok()
          .header(ALLOW_METHODS, METHODS)
          .header(ALLOW_HEADERS, HEADERS)
          .header(MAX_AGE, ONE_DAY)
          .build());
    }
  }

  @Override
  public void filter(final ContainerRequestContext requestContext,
                     final ContainerResponseContext responseContext) throws IOException {
    final MultivaluedMap<String, Object> headers = responseContext.getHeaders();
    headers.putSingle(ALLOW_ORIGIN, "*");
  }

  private void stripStagePrefix(final ContainerRequestContext requestContext) {
    final URI baseUri = requestContext.getUriInfo().getBaseUri();
    final URI requestUri = requestContext.getUriInfo().getRequestUri();
    final String basePath = baseUri.getRawPath();
    final String rawPath = requestUri.getRawPath();
    if (!rawPath.startsWith(basePath)) {
      return;
    }
    final String relative = rawPath.substring(basePath.length());
    for (String prefix : STAGE_PREFIXES) {
      if (relative.equals(prefix) || relative.startsWith(prefix + "/")) {
        final String remainder = relative.substring(prefix.length());
        final String newPath = basePath + (remainder.startsWith("/") ? remainder.substring(1) : remainder);
        final URI newUri = UriBuilder.fromUri(requestUri).replacePath(newPath).build();
        LOGGER.trace("stripStagePrefix({} -> {})", rawPath, newPath);
        requestContext.setRequestUri(newUri);
        return;
      }
    }
  }

}
