package com.truetickets.tickets.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Attachments configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAttachmentsConfiguration.class)
@JsonDeserialize(as = ImmutableAttachmentsConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface AttachmentsConfiguration {

  /**
   * Bucket the attachments are uploaded to.
   *
   * @return the string
   */
  @JsonProperty("bucket")
  String bucket();

  /**
   * Region string.
   *
   * @return the string
   */
  @JsonProperty("region")
  String region();

}
