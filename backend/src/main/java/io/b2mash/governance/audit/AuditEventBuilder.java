package io.b2mash.governance.audit;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. When not set
 * explicitly, {@code actorType} defaults to "SYSTEM", {@code source} to "SCHEDULED" and {@code
 * severity} to "info".
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("governance.data_retention.completed")
 *     .entityType("governance.data_retention_run")
 *     .entityId(runId)
 *     .severity("notice")
 *     .details(Map.of("affectedRows", 42))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorType = "SYSTEM";
  private String source = "SCHEDULED";
  private String severity = "info";
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
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

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  /** Source derived from a trigger name such as "scheduled", "startup" or "manual". */
  public AuditEventBuilder source(String source) {
    this.source = source != null ? source.toUpperCase(Locale.ROOT) : null;
    return this;
  }

  public AuditEventBuilder severity(String severity) {
    this.severity = severity;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalStateException("eventType is required");
    }
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalStateException("entityType is required");
    }
    if (entityId == null) {
      throw new IllegalStateException("entityId is required");
    }
    String resolvedActorType = "MANUAL".equals(source) ? "OPERATOR" : actorType;
    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActorType, source, severity, details);
  }
}
