package com.truetickets.server.exception;

/**
 * The entity asked for does not exist. Maps to 404.
 */
public class NotFoundException extends ServiceException {

  /**
   * Instantiates a new Not found exception.
   *
   * @param error   the error
   * @param details the details
   */
  public NotFoundException(final String error, final String details) {
    super(404, error, details, null, null);
  }

  /**
   * Instantiates a new Not found exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public NotFoundException(final String error, final String details, final String suggestion) {
    super(404, error, details, suggestion, null);
  }

}
