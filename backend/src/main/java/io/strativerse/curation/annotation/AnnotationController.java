package io.strativerse.curation.annotation;

import io.strativerse.curation.annotation.dto.AttachmentResponse;
import io.strativerse.curation.annotation.dto.CreateAttachmentRequest;
import io.strativerse.curation.annotation.dto.CreateTagRequest;
import io.strativerse.curation.annotation.dto.TagResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Tags and attachments of any entity, addressed as {@code /api/annotations/{kind}/{id}}. */
@RestController
@RequestMapping("/api/annotations/{kind}/{id}")
public class AnnotationController {

  private final AnnotationService annotationService;

  public AnnotationController(AnnotationService annotationService) {
    this.annotationService = annotationService;
  }

  @GetMapping("/tags")
  public ResponseEntity<List<TagResponse>> listTags(
      @PathVariable String kind,
      @PathVariable UUID id,
      @RequestParam(required = false) String type) {
    var owner = owner(kind, id);
    var tags =
        type != null && !type.isBlank()
            ? annotationService.listTags(owner, type)
            : annotationService.listTags(owner);
    return ResponseEntity.ok(tags.stream().map(TagResponse::from).toList());
  }

  @PostMapping("/tags")
  public ResponseEntity<TagResponse> attachTag(
      @PathVariable String kind,
      @PathVariable UUID id,
      @Valid @RequestBody CreateTagRequest request) {
    var tag =
        annotationService.attachTag(
            owner(kind, id), request.type(), request.key(), request.value(), request.comment());
    var location =
        URI.create(
            "/api/annotations/%s/%s/tags/%s/%s"
                .formatted(kind, id, tag.getType(), tag.getKey()));
    return ResponseEntity.created(location).body(TagResponse.from(tag));
  }

  @DeleteMapping("/tags/{type}/{key}")
  public ResponseEntity<Void> deleteTag(
      @PathVariable String kind,
      @PathVariable UUID id,
      @PathVariable String type,
      @PathVariable String key) {
    annotationService.deleteTag(owner(kind, id), type, key);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/attachments")
  public ResponseEntity<List<AttachmentResponse>> listAttachments(
      @PathVariable String kind,
      @PathVariable UUID id,
      @RequestParam(required = false) String type) {
    var owner = owner(kind, id);
    var attachments =
        type != null && !type.isBlank()
            ? annotationService.listAttachments(owner, type)
            : annotationService.listAttachments(owner);
    return ResponseEntity.ok(attachments.stream().map(AttachmentResponse::from).toList());
  }

  @PostMapping("/attachments")
  public ResponseEntity<AttachmentResponse> attachFile(
      @PathVariable String kind,
      @PathVariable UUID id,
      @Valid @RequestBody CreateAttachmentRequest request) {
    var attachment =
        annotationService.attachFile(
            owner(kind, id),
            request.type(),
            request.key(),
            request.fileRef(),
            request.fileName(),
            request.comment());
    return ResponseEntity.status(HttpStatus.CREATED).body(AttachmentResponse.from(attachment));
  }

  @DeleteMapping("/attachments/{type}/{key}")
  public ResponseEntity<Void> deleteAttachment(
      @PathVariable String kind,
      @PathVariable UUID id,
      @PathVariable String type,
      @PathVariable String key) {
    annotationService.deleteAttachment(owner(kind, id), type, key);
    return ResponseEntity.noContent().build();
  }

  private static AnnotationOwner owner(String kind, UUID id) {
    return new AnnotationOwner(EntityKind.parse(kind), id);
  }
}
