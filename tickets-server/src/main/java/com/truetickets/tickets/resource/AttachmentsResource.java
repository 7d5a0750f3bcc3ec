package com.truetickets.tickets.resource;

import com.codahale.metrics.annotation.Timed;
import com.truetickets.api.v1.Attachments;
import com.truetickets.api.v1.model.AttachmentReference;
import com.truetickets.api.v1.model.UploadAttachmentRequest;
import com.truetickets.server.resource.JerseyResource;
import com.truetickets.tickets.manager.AttachmentManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The attachments resource.
 */
@Singleton
public class AttachmentsResource implements Attachments, JerseyResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(AttachmentsResource.class);

  private final AttachmentManager attachmentManager;

  /**
   * Instantiates a new Attachments resource.
   *
   * @param attachmentManager the attachment manager
   */
  @Inject
  public AttachmentsResource(final AttachmentManager attachmentManager) {
    LOGGER.info("AttachmentsResource({})", attachmentManager);
    this.attachmentManager = attachmentManager;
  }

  @Override
  @Timed
  public AttachmentReference upload(final UploadAttachmentRequest request) {
    LOGGER.trace("upload()");
    return AttachmentReference.of(attachmentManager.upload(Parameters.body(request)));
  }

}
