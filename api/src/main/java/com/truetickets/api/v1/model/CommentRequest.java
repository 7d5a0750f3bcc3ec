package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableCommentRequest.class)
@JsonDeserialize(as = ImmutableCommentRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CommentRequest {

  @JsonProperty("comment_body")
  String commentBody();

  @JsonProperty("tech_name")
  String techName();

}
