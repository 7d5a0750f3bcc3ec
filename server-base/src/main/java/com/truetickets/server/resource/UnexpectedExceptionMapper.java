package com.truetickets.server.resource;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Anything else is a bug. Logged with the stack trace, the caller gets a generic 500 envelope.
 */
@Singleton
public class UnexpectedExceptionMapper implements ExceptionMapper<RuntimeException>, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnexpectedExceptionMapper.class);

  /**
   * Instantiates a new Unexpected exception mapper.
   */
  @Inject
  public UnexpectedExceptionMapper() {
    LOGGER.info("UnexpectedExceptionMapper()");
  }

  @Override
  public Response toResponse(final RuntimeException exception) {
    LOGGER.error("Unexpected exception", exception);
    return ErrorResponses.of(500, "Internal Server Error", exception.getClass().getSimpleName(), Optional.empty());
  }
}
