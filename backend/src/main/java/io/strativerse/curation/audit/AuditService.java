package io.strativerse.curation.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** The revision log. Each committed curation change is described by one entry. */
public interface AuditService {

  /** Appends a revision inside the current transaction; it is discarded if that rolls back. */
  void log(AuditEventRecord record);

  /**
   * Newest revisions first. Null filter fields are ignored and {@code eventType} matches as a
   * prefix, so {@code "person."} selects every person revision.
   */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);
}
