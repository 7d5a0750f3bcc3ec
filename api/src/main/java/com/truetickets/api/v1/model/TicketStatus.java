package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Where a ticket is in the repair workflow. Serialized by its display name.
 * Only payment capture moves a ticket into {@link #RESOLVED}.
 */
public enum TicketStatus {

  DIAGNOSING("Diagnosing"),
  FINDING_PRICE("Finding Price"),
  APPROVAL_NEEDED("Approval Needed"),
  WAITING_FOR_PARTS("Waiting for Parts"),
  WAITING_OTHER("Waiting (Other)"),
  IN_PROGRESS("In Progress"),
  READY("Ready"),
  RESOLVED("Resolved"),
  OTHER("Other");

  private final String displayName;

  TicketStatus(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Finds the status for the display name.
   *
   * @param displayName the display name, as sent on the wire.
   * @return the status if one matches.
   */
  public static Optional<TicketStatus> find(final String displayName) {
    return Arrays.stream(values())
        .filter(status -> status.displayName.equals(displayName))
        .findFirst();
  }

  /**
   * Used by jackson.
   *
   * @param displayName the display name.
   * @return the status.
   */
  @JsonCreator
  public static TicketStatus fromDisplayName(final String displayName) {
    return find(displayName)
        .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + displayName));
  }

  /**
   * Display name.
   *
   * @return the string
   */
  @JsonValue
  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
