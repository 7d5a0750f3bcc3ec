package com.truetickets.server.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request bodies that are not json, or that do not fit the model, are bad input.
 */
@Singleton
public class JsonProcessingExceptionMapper implements ExceptionMapper<JsonProcessingException>, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonProcessingExceptionMapper.class);

  /**
   * Instantiates a new Json processing exception mapper.
   */
  @Inject
  public JsonProcessingExceptionMapper() {
    LOGGER.info("JsonProcessingExceptionMapper()");
  }

  @Override
  public Response toResponse(final JsonProcessingException exception) {
    LOGGER.debug("Unable to process json: {}", exception.getOriginalMessage());
    return ErrorResponses.of(400, "Invalid JSON", exception.getOriginalMessage(),
        Optional.of("Check the request body against the API model."));
  }
}
