package io.strativerse.curation.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)} for recording one revision.
 * Constructed by {@link AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "person", "publication")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actor name of the acting curator; "system" for unattended operations
 * @param comment free-text revision comment; nullable
 * @param details before/after snapshots and operation data as JSON; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actor,
    String comment,
    Map<String, Object> details) {}
