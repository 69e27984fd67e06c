package io.strativerse.curation.publication;

import io.strativerse.curation.publication.dto.PublicationResponse;
import io.strativerse.curation.publication.dto.UpdatePublicationRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/publications")
public class PublicationController {

  private final PublicationService publicationService;

  public PublicationController(PublicationService publicationService) {
    this.publicationService = publicationService;
  }

  @GetMapping
  public ResponseEntity<List<PublicationResponse>> list() {
    return ResponseEntity.ok(
        publicationService.list().stream().map(publicationService::describe).toList());
  }

  @GetMapping("/{slug}")
  public ResponseEntity<PublicationResponse> get(@PathVariable String slug) {
    return ResponseEntity.ok(publicationService.describe(publicationService.getBySlug(slug)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<PublicationResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdatePublicationRequest request) {
    return ResponseEntity.ok(publicationService.describe(publicationService.update(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    publicationService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
