package io.b2mash.governance.partition;

import java.time.LocalDate;

/**
 * Outcome of evaluating one expired partition.
 *
 * @param partition partition label
 * @param start inclusive lower bound
 * @param end exclusive upper bound
 * @param status outcome
 * @param reason why the partition was skipped or left in place, or the failure message
 * @param dropped whether the partition was physically dropped in this run
 * @param bucket archive bucket, when an archive exists
 * @param key archive key, when an archive exists
 * @param rowCount archived rows, when an archive exists
 * @param byteSize archived bytes, when an archive exists
 * @param checksum SHA-256 of the archived NDJSON, when an archive exists
 */
public record ArchivedPartition(
    String partition,
    LocalDate start,
    LocalDate end,
    ArchiveStatus status,
    String reason,
    boolean dropped,
    String bucket,
    String key,
    Long rowCount,
    Long byteSize,
    String checksum) {

  public static final String REASON_MANUAL_APPROVAL = "manual_approval_required";
  public static final String REASON_ALREADY_DROPPED = "already_dropped";
  public static final String REASON_ARCHIVE_PRESENT = "archive_record_present";
  public static final String REASON_DROP_DISABLED = "drop_disabled";
  public static final String REASON_RETENTION_ELAPSED = "retention_window_elapsed";

  static ArchivedPartition of(PartitionDescriptor partition, ArchiveStatus status, String reason) {
    return new ArchivedPartition(
        partition.name(),
        partition.start(),
        partition.end(),
        status,
        reason,
        false,
        null,
        null,
        null,
        null,
        null);
  }

  static ArchivedPartition withArchive(
      PartitionDescriptor partition,
      ArchiveStatus status,
      String reason,
      boolean dropped,
      ArchiveRecord archive) {
    return new ArchivedPartition(
        partition.name(),
        partition.start(),
        partition.end(),
        status,
        reason,
        dropped,
        archive.getStorageBucket(),
        archive.getStorageKey(),
        archive.getRowCount(),
        archive.getByteSize(),
        archive.getChecksum());
  }
}
