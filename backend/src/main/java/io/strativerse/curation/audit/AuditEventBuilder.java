package io.strativerse.curation.audit;

import io.strativerse.curation.config.CuratorContext;
import java.util.Map;
import java.util.UUID;

/**
 * Fluent construction of {@link AuditEventRecord}s. Without an explicit actor the curator bound to
 * the current request is recorded, or {@value #SYSTEM_ACTOR} outside a request. Comments longer
 * than the column are cut.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("person.combined")
 *     .entityType("person")
 *     .entityId(survivor.getId())
 *     .actor(actor)
 *     .details(Map.of("combined", ids))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  public static final String SYSTEM_ACTOR = "system";

  private static final int MAX_COMMENT_LENGTH = 1000;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actor;
  private String comment;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(String actor) {
    this.actor = actor;
    return this;
  }

  public AuditEventBuilder comment(String comment) {
    this.comment = comment;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null) {
      throw new IllegalStateException("eventType and entityType are required");
    }
    return new AuditEventRecord(
        eventType, entityType, entityId, resolveActor(), clip(comment), details);
  }

  private String resolveActor() {
    if (actor != null && !actor.isBlank()) {
      return actor;
    }
    String curator = CuratorContext.getCurrentCurator();
    return curator == null || curator.isBlank() ? SYSTEM_ACTOR : curator;
  }

  private static String clip(String text) {
    return text == null || text.length() <= MAX_COMMENT_LENGTH
        ? text
        : text.substring(0, MAX_COMMENT_LENGTH);
  }
}
