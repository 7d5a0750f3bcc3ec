package com.truetickets.server.exception;

/**
 * A batch read came back incomplete. We never return partial results, the caller retries. Maps to 503.
 */
public class PartialBatchException extends ServiceException {

  /**
   * Instantiates a new Partial batch exception.
   *
   * @param error   the error
   * @param details the details
   */
  public PartialBatchException(final String error, final String details) {
    super(503, error, details, null, null);
  }

  /**
   * Instantiates a new Partial batch exception.
   *
   * @param error      the error
   * @param details    the details
   * @param suggestion the suggestion
   */
  public PartialBatchException(final String error, final String details, final String suggestion) {
    super(503, error, details, suggestion, null);
  }

}
