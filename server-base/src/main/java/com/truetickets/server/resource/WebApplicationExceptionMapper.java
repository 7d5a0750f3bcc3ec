package com.truetickets.server.resource;

import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Errors raised by jersey itself. A path or method we do not serve is reported as method not allowed, the rest
 * keep their status.
 */
@Singleton
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException>, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebApplicationExceptionMapper.class);

  /**
   * Instantiates a new Web application exception mapper.
   */
  @Inject
  public WebApplicationExceptionMapper() {
    LOGGER.info("WebApplicationExceptionMapper()");
  }

  @Override
  public Response toResponse(final WebApplicationException exception) {
    if (exception instanceof NotFoundException || exception instanceof NotAllowedException) {
      LOGGER.debug("No route: {}", exception.getMessage());
      return ErrorResponses.of(405, "Method not allowed", "No route matches this request",
          Optional.of("You're sending a request that doesn't exist."));
    }
    final Response response = exception.getResponse();
    final int status = response.getStatus();
    LOGGER.debug("Web application exception {}: {}", status, exception.getMessage());
    return ErrorResponses.of(status, response.getStatusInfo().getReasonPhrase(),
        String.valueOf(exception.getMessage()), Optional.empty());
  }
}
