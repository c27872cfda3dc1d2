package io.b2mash.governance.retention;

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

/** One row per committed policy execution, including executions that matched nothing. */
@Entity
@Table(name = "data_retention_audit_logs")
public class RetentionAuditLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "policy_id", nullable = false)
  private Long policyId;

  @Column(name = "dry_run", nullable = false)
  private boolean dryRun;

  @Column(name = "rows_affected", nullable = false)
  private long rowsAffected;

  @Convert(converter = JsonMapConverter.class)
  @ColumnTransformer(write = "?::jsonb")
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RetentionAuditLog() {}

  public RetentionAuditLog(
      Long policyId, long rowsAffected, Map<String, Object> details, Instant createdAt) {
    this.policyId = policyId;
    this.dryRun = false;
    this.rowsAffected = rowsAffected;
    this.details = details;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public Long getPolicyId() {
    return policyId;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public long getRowsAffected() {
    return rowsAffected;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
