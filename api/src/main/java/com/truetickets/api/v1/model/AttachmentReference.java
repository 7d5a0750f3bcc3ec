package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableAttachmentReference.class)
@JsonDeserialize(as = ImmutableAttachmentReference.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface AttachmentReference {

  /**
   * Of attachment reference.
   *
   * @param url the url
   * @return the attachment reference
   */
  static AttachmentReference of(final String url) {
    return ImmutableAttachmentReference.builder().url(url).build();
  }

  @JsonProperty("url")
  String url();

}
