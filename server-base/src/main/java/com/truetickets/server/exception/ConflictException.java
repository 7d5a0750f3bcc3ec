package com.truetickets.server.exception;

/**
 * A condition on a write failed, the caller may reload and retry. Maps to 409.
 */
public class ConflictException extends ServiceException {

  /**
   * Instantiates a new Conflict exception.
   *
   * @param error   the error
   * @param details the details
   */
  public ConflictException(final String error, final String details) {
    super(409, error, details, null, null);
  }

  /**
   * Instantiates a new Conflict exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public ConflictException(final String error, final String details, final String suggestion) {
    super(409, error, details, suggestion, null);
  }

  /**
   * Instantiates a new exception from a cause.
   *
   * @param error   the error
   * @param details the details
   * @param cause   the cause
   */
  public ConflictException(final String error, final String details, final Throwable cause) {
    super(409, error, details, null, cause);
  }

}
