package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Used by clients to poll whether an entity changed since they loaded it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLastUpdated.class)
@JsonDeserialize(as = ImmutableLastUpdated.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface LastUpdated {

  /**
   * Of last updated.
   *
   * @param lastUpdated epoch seconds
   * @return the last updated
   */
  static LastUpdated of(final long lastUpdated) {
    return ImmutableLastUpdated.builder().lastUpdated(lastUpdated).build();
  }

  @JsonProperty("last_updated")
  long lastUpdated();

}
