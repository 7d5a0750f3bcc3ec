package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The custom fields of a legacy ticket that the import reads. Which password field holds the password depends on
 * the ticket type.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamProperties.class)
@JsonDeserialize(as = ImmutableUpstreamProperties.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamProperties {

  @JsonProperty("Password")
  Optional<String> password();

  @JsonProperty("Password (type \"none\" if no password)")
  Optional<String> passwordOrNone();

  @JsonProperty("passwordForPhone")
  Optional<String> passwordForPhone();

  @JsonProperty("AC Charger")
  Optional<String> acCharger();

}
