package com.truetickets.server.exception;

/**
 * Something broke on our side, including data that breaks an integrity rule. Maps to 500.
 */
public class InternalException extends ServiceException {

  /**
   * Instantiates a new Internal exception.
   *
   * @param error   the error
   * @param details the details
   */
  public InternalException(final String error, final String details) {
    super(500, error, details, null, null);
  }

  /**
   * Instantiates a new Internal exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public InternalException(final String error, final String details, final String suggestion) {
    super(500, error, details, suggestion, null);
  }

  /**
   * Instantiates a new exception from a cause.
   *
   * @param error   the error
   * @param details the details
   * @param cause   the cause
   */
  public InternalException(final String error, final String details, final Throwable cause) {
    super(500, error, details, null, cause);
  }

}
