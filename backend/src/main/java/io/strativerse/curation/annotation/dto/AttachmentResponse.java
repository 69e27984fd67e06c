package io.strativerse.curation.annotation.dto;

import io.strativerse.curation.annotation.Attachment;
import java.time.Instant;
import java.util.UUID;

public record AttachmentResponse(
    UUID id,
    String type,
    String key,
    String fileRef,
    String fileName,
    String comment,
    Instant createdAt) {

  public static AttachmentResponse from(Attachment attachment) {
    return new AttachmentResponse(
        attachment.getId(),
        attachment.getType(),
        attachment.getKey(),
        attachment.getFileRef(),
        attachment.getFileName(),
        attachment.getComment(),
        attachment.getCreatedAt());
  }
}
