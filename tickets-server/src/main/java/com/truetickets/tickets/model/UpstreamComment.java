package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Upstream comment.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamComment.class)
@JsonDeserialize(as = ImmutableUpstreamComment.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamComment {

  @JsonProperty("body")
  Optional<String> body();

  @JsonProperty("tech")
  Optional<String> tech();

  @JsonProperty("created_at")
  Optional<String> createdAt();

}
