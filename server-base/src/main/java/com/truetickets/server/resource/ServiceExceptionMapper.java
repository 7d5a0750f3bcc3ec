package com.truetickets.server.resource;

import com.truetickets.server.exception.ServiceException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders our own exceptions in the error envelope with their status.
 */
@Singleton
public class ServiceExceptionMapper implements ExceptionMapper<ServiceException>, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ServiceExceptionMapper.class);

  /**
   * Instantiates a new Service exception mapper.
   */
  @Inject
  public ServiceExceptionMapper() {
    LOGGER.info("ServiceExceptionMapper()");
  }

  @Override
  public Response toResponse(final ServiceException exception) {
    if (exception.status() >= 500) {
      LOGGER.warn("{}: {}", exception.status(), exception.getMessage(), exception);
    } else {
      LOGGER.debug("{}: {}", exception.status(), exception.getMessage());
    }
    return ErrorResponses.of(exception.status(), exception.error(), exception.details(), exception.suggestion());
  }
}
