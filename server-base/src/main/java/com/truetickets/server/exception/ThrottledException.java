package com.truetickets.server.exception;

/**
 * The store is throttling or failing transiently, the caller should retry. Maps to 503.
 */
public class ThrottledException extends ServiceException {

  /**
   * Instantiates a new Throttled exception.
   *
   * @param error   the error
   * @param details the details
   */
  public ThrottledException(final String error, final String details) {
    super(503, error, details, null, null);
  }

  /**
   * Instantiates a new Throttled exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public ThrottledException(final String error, final String details, final String suggestion) {
    super(503, error, details, suggestion, null);
  }

  /**
   * Instantiates a new exception from a cause.
   *
   * @param error   the error
   * @param details the details
   * @param cause   the cause
   */
  public ThrottledException(final String error, final String details, final Throwable cause) {
    super(503, error, details, null, cause);
  }

}
