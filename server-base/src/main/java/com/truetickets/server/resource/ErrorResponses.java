package com.truetickets.server.resource;

import com.truetickets.api.v1.model.ErrorResponse;
import com.truetickets.api.v1.model.ImmutableErrorResponse;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Optional;

/**
 * Builds responses holding the error envelope.
 */
public final class ErrorResponses {

  private ErrorResponses() {
  }

  /**
   * Response for the values.
   *
   * @param status     http status.
   * @param error      short title.
   * @param details    what went wrong.
   * @param suggestion what the caller could do.
   * @return the response
   */
  public static Response of(final int status,
                            final String error,
                            final String details,
                            final Optional<String> suggestion) {
    final ErrorResponse entity = ImmutableErrorResponse.builder()
        .error(error)
        .details(details)
        .suggestion(suggestion)
        .build();
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(entity)
        .build();
  }

}
