package io.strativerse.curation.publication.dto;

import io.strativerse.curation.publication.Publication;
import java.util.List;
import java.util.UUID;

public record PublicationResponse(
    UUID id,
    String slug,
    String title,
    int year,
    String doi,
    String url,
    String type,
    String authorDateKey,
    List<AuthorshipResponse> authorships) {

  public static PublicationResponse from(
      Publication publication, String authorDateKey, List<AuthorshipResponse> authorships) {
    return new PublicationResponse(
        publication.getId(),
        publication.getSlug(),
        publication.getTitle(),
        publication.getYear(),
        publication.getDoi(),
        publication.getUrl(),
        publication.getType().cslName(),
        authorDateKey,
        authorships);
  }
}
