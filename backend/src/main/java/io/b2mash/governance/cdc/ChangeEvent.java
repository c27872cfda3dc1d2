package io.b2mash.governance.cdc;

import io.b2mash.governance.support.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.ColumnTransformer;

/**
 * Outbox row describing one data-lifecycle operation. Rows are written with status {@code pending}
 * and picked up by an external relay; delivery is at-least-once, so consumers dedupe on {@link
 * #getEventUuid()}.
 */
@Entity
@Table(name = "cdc_outbox")
public class ChangeEvent {

  public static final String STATUS_PENDING = "pending";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_uuid", nullable = false, unique = true, updatable = false)
  private UUID eventUuid;

  @Column(name = "domain", nullable = false, length = 60)
  private String domain;

  @Column(name = "entity_name", nullable = false, length = 120)
  private String entityName;

  @Column(name = "entity_id", length = 200)
  private String entityId;

  @Column(name = "operation", nullable = false, length = 60)
  private String operation;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "dry_run", nullable = false)
  private boolean dryRun;

  @Column(name = "correlation_id", length = 100)
  private String correlationId;

  @Convert(converter = JsonMapConverter.class)
  @ColumnTransformer(write = "?::jsonb")
  @Column(name = "payload", columnDefinition = "jsonb")
  private Map<String, Object> payload;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChangeEvent() {}

  public ChangeEvent(ChangeEventRequest request, Instant createdAt) {
    this.eventUuid = UUID.randomUUID();
    this.domain = request.domain();
    this.entityName = request.entityName();
    this.entityId = request.entityId();
    this.operation = request.operation();
    this.status = STATUS_PENDING;
    this.dryRun = request.dryRun();
    this.correlationId = request.correlationId();
    this.payload = request.payload();
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEventUuid() {
    return eventUuid;
  }

  public String getDomain() {
    return domain;
  }

  public String getEntityName() {
    return entityName;
  }

  public String getEntityId() {
    return entityId;
  }

  public String getOperation() {
    return operation;
  }

  public String getStatus() {
    return status;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
