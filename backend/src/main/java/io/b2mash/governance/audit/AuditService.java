package io.b2mash.governance.audit;

import java.util.List;

/** Records and queries governance audit events. */
public interface AuditService {

  /**
   * Records a single audit event. Participates in the caller's transaction when one is active.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Most recent events for an entity type, newest first.
   *
   * @param entityType e.g. "governance.data_retention_run"
   * @param limit maximum number of events returned
   */
  List<AuditEvent> findRecent(String entityType, int limit);
}
