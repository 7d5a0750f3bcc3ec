package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * The kind of device a ticket is about. Serialized by its display name.
 */
public enum Device {

  PHONE("Phone"),
  TABLET("Tablet"),
  LAPTOP("Laptop"),
  DESKTOP("Desktop"),
  WATCH("Watch"),
  CONSOLE("Console"),
  OTHER("Other");

  private final String displayName;

  Device(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Finds the device for the display name.
   *
   * @param displayName the display name, as sent on the wire.
   * @return the device if one matches.
   */
  public static Optional<Device> find(final String displayName) {
    return Arrays.stream(values())
        .filter(device -> device.displayName.equals(displayName))
        .findFirst();
  }

  /**
   * Used by jackson.
   *
   * @param displayName the display name.
   * @return the device.
   */
  @JsonCreator
  public static Device fromDisplayName(final String displayName) {
    return find(displayName)
        .orElseThrow(() -> new IllegalArgumentException("Unknown device: " + displayName));
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
