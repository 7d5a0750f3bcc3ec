package com.truetickets.api.v1;

import com.truetickets.api.v1.model.AttachmentReference;
import com.truetickets.api.v1.model.UploadAttachmentRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * The interface Attachments.
 */
@Path("/upload-attachment")
@Produces(MediaType.APPLICATION_JSON)
public interface Attachments {

  /**
   * Stores the attachment and adds its url to the ticket.
   *
   * @param request the request
   * @return the url of the attachment
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  AttachmentReference upload(UploadAttachmentRequest request);

}
