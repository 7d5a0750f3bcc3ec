package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Where the legacy system keeps an attachment. The url may carry escaped ampersands.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpstreamFile.class)
@JsonDeserialize(as = ImmutableUpstreamFile.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpstreamFile {

  @JsonProperty("url")
  String url();

}
