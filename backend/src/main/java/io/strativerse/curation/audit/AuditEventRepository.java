package io.strativerse.curation.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /** Revision log search; a null argument leaves that column unconstrained. */
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE (:entityType IS NULL OR e.entityType = :entityType)
        AND (:entityId IS NULL OR e.entityId = :entityId)
        AND (:actor IS NULL OR e.actor = :actor)
        AND (CAST(:eventTypePrefix AS string) IS NULL
          OR e.eventType LIKE CONCAT(CAST(:eventTypePrefix AS string), '%'))
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("entityType") String entityType,
      @Param("entityId") UUID entityId,
      @Param("actor") String actor,
      @Param("eventTypePrefix") String eventTypePrefix,
      Pageable pageable);

  List<AuditEvent> findByEventTypeOrderByOccurredAtAsc(String eventType);
}
