package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A comment on a ticket. Receipts for payments are comments too.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableComment.class)
@JsonDeserialize(as = ImmutableComment.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Comment {

  @JsonProperty("comment_body")
  String commentBody();

  @JsonProperty("tech_name")
  String techName();

  @JsonProperty("created_at")
  long createdAt();

}
