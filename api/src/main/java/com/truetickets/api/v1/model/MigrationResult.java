package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Outcome of a migration batch.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMigrationResult.class)
@JsonDeserialize(as = ImmutableMigrationResult.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface MigrationResult {

  @JsonProperty("migrated_count")
  int migratedCount();

  /**
   * The ticket counter after the batch.
   *
   * @return the long
   */
  @JsonProperty("highest_ticket_number")
  long highestTicketNumber();

}
