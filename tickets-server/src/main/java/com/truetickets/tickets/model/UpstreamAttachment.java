package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamAttachment.class)
@JsonDeserialize(as = ImmutableUpstreamAttachment.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamAttachment {

  @JsonProperty("file")
  UpstreamFile file();

}
