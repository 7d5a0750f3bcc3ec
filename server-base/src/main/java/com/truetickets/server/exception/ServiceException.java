package com.truetickets.server.exception;

import java.util.Optional;

/**
 * Base of the exceptions that become an error response. The status is the http status code, the error is a short
 * title and the details say what went wrong. The suggestion, if any, tells the caller what to do about it.
 */
public abstract class ServiceException extends RuntimeException {

  private final int status;
  private final String error;
  private final String details;
  private final String suggestion;

  /**
   * Instantiates a new Service exception.
   *
   * @param status     the status
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion, nullable
   * @param cause      the cause, nullable
   */
  protected ServiceException(final int status,
                             final String error,
                             final String details,
                             final String suggestion,
                             final Throwable cause) {
    super(error + ": " + details, cause);
    this.status = status;
    this.error = error;
    this.details = details;
    this.suggestion = suggestion;
  }

  public int status() {
    return status;
  }

  public String error() {
    return error;
  }

  public String details() {
    return details;
  }

  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

}
