package io.strativerse.curation.annotation.dto;

import io.strativerse.curation.annotation.Tag;
import java.time.Instant;
import java.util.UUID;

public record TagResponse(
    UUID id, String type, String key, String value, String comment, Instant createdAt) {

  public static TagResponse from(Tag tag) {
    return new TagResponse(
        tag.getId(),
        tag.getType(),
        tag.getKey(),
        tag.getValue(),
        tag.getComment(),
        tag.getCreatedAt());
  }
}
