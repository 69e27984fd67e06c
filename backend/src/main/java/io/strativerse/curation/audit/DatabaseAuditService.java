package io.strativerse.curation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores revisions in {@code audit_events}. Writes join the caller's transaction, so a revision
 * exists exactly when the change it describes was committed.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;

  public DatabaseAuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var saved = auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Revision {} by {}: {} on {} {}",
        saved.getId(),
        record.actor(),
        record.eventType(),
        record.entityType(),
        record.entityId());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    String prefix = filter.eventType();
    if (prefix != null && prefix.isBlank()) {
      prefix = null;
    }
    return auditEventRepository.findByFilter(
        filter.entityType(), filter.entityId(), filter.actor(), prefix, pageable);
  }
}
