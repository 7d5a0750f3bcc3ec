package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Upload attachment request.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUploadAttachmentRequest.class)
@JsonDeserialize(as = ImmutableUploadAttachmentRequest.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UploadAttachmentRequest {

  /**
   * Ticket number the attachment belongs to.
   *
   * @return the long
   */
  @JsonProperty("ticket_id")
  long ticketId();

  /**
   * Base64 content, either raw or as a data url like {@code data:image/png;base64,....}.
   *
   * @return the string
   */
  @JsonProperty("image_data")
  String imageData();

  /**
   * Original file name, if the client knows it.
   *
   * @return the optional
   */
  @JsonProperty("file_name")
  Optional<String> fileName();

}
