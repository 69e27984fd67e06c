package io.strativerse.curation.audit;

import java.util.UUID;

/**
 * Query filter record for {@link AuditService#findEvents}. All fields are nullable -- null means
 * "no filter on this field".
 *
 * @param entityType filter by entity kind (e.g., "person", "publication")
 * @param entityId filter by specific entity
 * @param actor filter by acting curator
 * @param eventType filter by event type (prefix match -- "person." matches person.created,
 *     person.combined)
 */
public record AuditEventFilter(String entityType, UUID entityId, String actor, String eventType) {}
