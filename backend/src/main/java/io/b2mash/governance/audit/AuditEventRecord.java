package io.b2mash.governance.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType event type following the {@code governance.{subject}.{outcome}} convention
 * @param entityType the kind of run being audited (e.g. "governance.data_retention_run")
 * @param entityId run identifier
 * @param actorType SYSTEM for scheduled work, OPERATOR for manual triggers
 * @param source origin of the action: SCHEDULED, STARTUP, MANUAL
 * @param severity info, notice, or warning
 * @param details totals and failures as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorType,
    String source,
    String severity,
    Map<String, Object> details) {}
