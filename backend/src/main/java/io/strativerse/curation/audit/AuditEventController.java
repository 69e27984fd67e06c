package io.strativerse.curation.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PagedModel;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read access to the revision log, serialized as a stable {@link PagedModel} DTO. */
@RestController
public class AuditEventController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/audit-events")
  public ResponseEntity<PagedModel<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(required = false) String actor,
      @RequestParam(required = false) String eventType,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var filter = new AuditEventFilter(entityType, entityId, actor, eventType);
    return ResponseEntity.ok(new PagedModel<>(find(filter, page, size)));
  }

  @GetMapping("/api/audit-events/{entityType}/{entityId}")
  public ResponseEntity<PagedModel<AuditEventResponse>> listAuditEventsByEntity(
      @PathVariable String entityType,
      @PathVariable UUID entityId,
      @RequestParam(required = false) String eventType,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var filter = new AuditEventFilter(entityType, entityId, null, eventType);
    return ResponseEntity.ok(new PagedModel<>(find(filter, page, size)));
  }

  private Page<AuditEventResponse> find(AuditEventFilter filter, int page, int size) {
    var pageable =
        PageRequest.of(
            Math.max(page, 0),
            Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "occurredAt"));
    return auditService.findEvents(filter, pageable).map(AuditEventResponse::from);
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      String actor,
      String comment,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActor(),
          event.getComment(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
