package com.truetickets.server.exception;

/**
 * The caller lacks the role the operation needs. Maps to 403.
 */
public class ForbiddenException extends ServiceException {

  /**
   * Instantiates a new Forbidden exception.
   *
   * @param error   the error
   * @param details the details
   */
  public ForbiddenException(final String error, final String details) {
    super(403, error, details, null, null);
  }

  /**
   * Instantiates a new Forbidden exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public ForbiddenException(final String error, final String details, final String suggestion) {
    super(403, error, details, suggestion, null);
  }

}
