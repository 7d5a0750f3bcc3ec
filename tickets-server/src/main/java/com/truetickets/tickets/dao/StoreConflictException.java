package com.truetickets.tickets.dao;

import com.truetickets.server.exception.ConflictException;
import java.util.List;

/**
 * A write condition failed or a transaction was cancelled by a concurrent one. The reason codes are kept, one per
 * transaction member, so callers can tell which member failed.
 */
public class StoreConflictException extends ConflictException {

  /**
   * The store's code for a failed condition.
   */
  public static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

  private final List<String> reasons;

  /**
   * Instantiates a new Store conflict exception.
   *
   * @param reasons the reason codes, empty for a single item write
   * @param cause   the cause
   */
  public StoreConflictException(final List<String> reasons, final Throwable cause) {
    super("Conflict", "State changed during processing. Please try again.", cause);
    this.reasons = List.copyOf(reasons);
  }

  public List<String> reasons() {
    return reasons;
  }

  /**
   * If the transaction member at the index failed its condition.
   *
   * @param index the index
   * @return the boolean
   */
  public boolean failedAt(final int index) {
    return index < reasons.size() && CONDITIONAL_CHECK_FAILED.equals(reasons.get(index));
  }

}
