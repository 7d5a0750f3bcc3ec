package com.truetickets.server.exception;

/**
 * The request is malformed or asks for something that is not allowed. Maps to 400.
 */
public class BadInputException extends ServiceException {

  /**
   * Instantiates a new Bad input exception.
   *
   * @param error   the error
   * @param details the details
   */
  public BadInputException(final String error, final String details) {
    super(400, error, details, null, null);
  }

  /**
   * Instantiates a new Bad input exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public BadInputException(final String error, final String details, final String suggestion) {
    super(400, error, details, suggestion, null);
  }

}
