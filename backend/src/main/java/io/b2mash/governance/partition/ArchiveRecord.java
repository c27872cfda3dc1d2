package io.b2mash.governance.partition;

import io.b2mash.governance.support.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.ColumnTransformer;

/**
 * Manifest proving a partition was exported to object storage. A record without {@code
 * droppedAt} means the drop is still pending and safe to retry.
 */
@Entity
@Table(name = "data_partition_archives")
public class ArchiveRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "table_name", nullable = false, length = 63)
  private String tableName;

  @Column(name = "partition_name", nullable = false, length = 63)
  private String partitionName;

  @Column(name = "range_start", nullable = false)
  private LocalDate rangeStart;

  @Column(name = "range_end", nullable = false)
  private LocalDate rangeEnd;

  @Column(name = "retention_days", nullable = false)
  private int retentionDays;

  @Column(name = "archived_at", nullable = false)
  private Instant archivedAt;

  @Column(name = "dropped_at")
  private Instant droppedAt;

  @Column(name = "storage_bucket", nullable = false)
  private String storageBucket;

  @Column(name = "storage_key", nullable = false, length = 1024)
  private String storageKey;

  @Column(name = "row_count", nullable = false)
  private long rowCount;

  @Column(name = "byte_size", nullable = false)
  private long byteSize;

  @Column(name = "checksum", nullable = false, length = 64)
  private String checksum;

  @Convert(converter = JsonMapConverter.class)
  @ColumnTransformer(write = "?::jsonb")
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, Object> metadata;

  protected ArchiveRecord() {}

  public ArchiveRecord(
      String tableName,
      PartitionDescriptor partition,
      int retentionDays,
      Instant archivedAt,
      String storageBucket,
      String storageKey,
      long rowCount,
      long byteSize,
      String checksum,
      Map<String, Object> metadata) {
    this.tableName = tableName;
    this.partitionName = partition.name();
    this.rangeStart = partition.start();
    this.rangeEnd = partition.end();
    this.retentionDays = retentionDays;
    this.archivedAt = archivedAt;
    this.storageBucket = storageBucket;
    this.storageKey = storageKey;
    this.rowCount = rowCount;
    this.byteSize = byteSize;
    this.checksum = checksum;
    this.metadata = metadata;
  }

  public void markDropped(Instant droppedAt) {
    this.droppedAt = droppedAt;
  }

  public boolean isDropped() {
    return droppedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public String getTableName() {
    return tableName;
  }

  public String getPartitionName() {
    return partitionName;
  }

  public LocalDate getRangeStart() {
    return rangeStart;
  }

  public LocalDate getRangeEnd() {
    return rangeEnd;
  }

  public int getRetentionDays() {
    return retentionDays;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }

  public Instant getDroppedAt() {
    return droppedAt;
  }

  public String getStorageBucket() {
    return storageBucket;
  }

  public String getStorageKey() {
    return storageKey;
  }

  public long getRowCount() {
    return rowCount;
  }

  public long getByteSize() {
    return byteSize;
  }

  public String getChecksum() {
    return checksum;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }
}
