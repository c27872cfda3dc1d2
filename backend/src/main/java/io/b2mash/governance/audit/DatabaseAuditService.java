package io.b2mash.governance.audit;

import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}. Delegates persistence and querying to
 * {@link AuditEventRepository}.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final Clock clock;

  public DatabaseAuditService(AuditEventRepository auditEventRepository, Clock clock) {
    this.auditEventRepository = auditEventRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(record, clock.instant());
    auditEventRepository.save(event);
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, severity={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.severity());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findRecent(String entityType, int limit) {
    return auditEventRepository.findByEntityTypeOrderByOccurredAtDesc(
        entityType, Limit.of(Math.max(1, limit)));
  }
}
