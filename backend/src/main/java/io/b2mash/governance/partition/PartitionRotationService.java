package io.b2mash.governance.partition;

import io.b2mash.governance.audit.AuditEventBuilder;
import io.b2mash.governance.audit.AuditService;
import io.b2mash.governance.cdc.ChangeDataCaptureService;
import io.b2mash.governance.cdc.ChangeEventRequest;
import io.b2mash.governance.config.S3Config.S3Properties;
import io.b2mash.governance.partition.archive.ArchiveExporter;
import io.b2mash.governance.partition.archive.ArchiveRequest;
import io.b2mash.governance.partition.archive.ArchiveResult;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Provisions future monthly partitions and retires expired ones.
 *
 * <p>Expired partitions are evaluated oldest first. A partition is dropped only after its archive
 * manifest exists, and never when fewer than {@code minActivePartitions} partitions would remain.
 * Failures are contained: one partition's failure is reported and the next partition is
 * evaluated; one policy's failure is reported and the next policy runs. Dropping a partition and
 * stamping its manifest commit together, so a failed save leaves the partition in place and the
 * drop is retried on the next run.
 */
@Service
public class PartitionRotationService {

  private static final Logger log = LoggerFactory.getLogger(PartitionRotationService.class);

  static final int DEFAULT_ARCHIVE_LIST_LIMIT = 25;
  static final String RUN_ENTITY_TYPE = "governance.data_partition_run";

  private final PartitionPolicyRepository policyRepository;
  private final PartitionCatalog partitionCatalog;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final ArchiveExporter archiveExporter;
  private final ChangeDataCaptureService changeDataCaptureService;
  private final AuditService auditService;
  private final PartitionProperties properties;
  private final S3Properties s3Properties;
  private final Clock clock;
  private final TransactionTemplate dropTransaction;

  public PartitionRotationService(
      PartitionPolicyRepository policyRepository,
      PartitionCatalog partitionCatalog,
      ArchiveRecordRepository archiveRecordRepository,
      ArchiveExporter archiveExporter,
      ChangeDataCaptureService changeDataCaptureService,
      AuditService auditService,
      PartitionProperties properties,
      S3Properties s3Properties,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.policyRepository = policyRepository;
    this.partitionCatalog = partitionCatalog;
    this.archiveRecordRepository = archiveRecordRepository;
    this.archiveExporter = archiveExporter;
    this.changeDataCaptureService = changeDataCaptureService;
    this.auditService = auditService;
    this.properties = properties;
    this.s3Properties = s3Properties;
    this.clock = clock;
    this.dropTransaction = new TransactionTemplate(transactionManager);
  }

  /** Rotates with the configured dry-run setting. */
  public PartitionRunSummary rotate() {
    return rotate(properties.dryRun());
  }

  public PartitionRunSummary rotate(boolean dryRun) {
    String runId = UUID.randomUUID().toString();
    if (!properties.enabled()) {
      log.warn("Data partitioning disabled; skipping rotation run {}", runId);
      return new PartitionRunSummary(
          runId, dryRun, PartitionRunSummary.STATUS_DISABLED, clock.instant(), List.of());
    }

    List<PartitionPolicyOutcome> results = new ArrayList<>();
    for (PartitionPolicy policy : policyRepository.findAll()) {
      if (!policy.isMonthlyRange()) {
        log.debug(
            "Skipping partition policy {} with unsupported strategy {}",
            policy.id(),
            policy.strategy());
        continue;
      }
      results.add(rotatePolicy(policy, dryRun, runId));
    }

    var summary =
        new PartitionRunSummary(
            runId, dryRun, PartitionRunSummary.STATUS_COMPLETED, clock.instant(), results);
    log.info(
        "Data partition rotation {} completed: dryRun={}, policies={}, created={}, dropped={}",
        runId,
        dryRun,
        results.size(),
        summary.countCreated(),
        summary.countDropped());
    if (!dryRun) {
      recordRotationAudit(summary);
    }
    return summary;
  }

  /**
   * Most recent archive manifests, newest first.
   *
   * @param tableName restrict to one table; null for all tables
   * @param limit maximum number of manifests; non-positive values use the default of 25
   * @param includeDropped include manifests whose partition has already been dropped
   */
  public List<ArchiveRecord> listArchives(String tableName, int limit, boolean includeDropped) {
    Limit max = Limit.of(limit > 0 ? limit : DEFAULT_ARCHIVE_LIST_LIMIT);
    if (tableName == null || tableName.isBlank()) {
      return includeDropped
          ? archiveRecordRepository.findAllByOrderByArchivedAtDesc(max)
          : archiveRecordRepository.findByDroppedAtIsNullOrderByArchivedAtDesc(max);
    }
    return includeDropped
        ? archiveRecordRepository.findByTableNameOrderByArchivedAtDesc(tableName, max)
        : archiveRecordRepository.findByTableNameAndDroppedAtIsNullOrderByArchivedAtDesc(
            tableName, max);
  }

  private PartitionPolicyOutcome rotatePolicy(
      PartitionPolicy policy, boolean dryRun, String runId) {
    List<EnsuredPartition> ensured = new ArrayList<>();
    List<ArchivedPartition> archived = new ArrayList<>();
    try {
      List<PartitionDescriptor> partitions =
          new ArrayList<>(partitionCatalog.listPartitions(policy.tableName()));
      ensured.addAll(ensureFuturePartitions(policy, partitions, dryRun));
      archived.addAll(archiveExpiredPartitions(policy, partitions, dryRun, runId));
      return new PartitionPolicyOutcome(
          policy.id(),
          policy.tableName(),
          ensured,
          archived,
          PartitionPolicyOutcome.STATUS_OK,
          null);
    } catch (RuntimeException e) {
      log.error(
          "Failed to manage partitions for policy {} table {} (run {})",
          policy.id(),
          policy.tableName(),
          runId,
          e);
      return new PartitionPolicyOutcome(
          policy.id(),
          policy.tableName(),
          ensured,
          archived,
          PartitionPolicyOutcome.STATUS_FAILED,
          e.getMessage());
    }
  }

  List<EnsuredPartition> ensureFuturePartitions(
      PartitionPolicy policy, List<PartitionDescriptor> partitions, boolean dryRun) {
    Set<String> existing = new HashSet<>();
    partitions.forEach(partition -> existing.add(partition.name()));

    List<EnsuredPartition> additions = new ArrayList<>();
    YearMonth current = YearMonth.now(clock);
    for (int offset = -properties.lookbehindMonths();
        offset <= properties.lookaheadMonths();
        offset++) {
      PartitionDescriptor descriptor = PartitionDescriptor.monthly(current.plusMonths(offset));
      if (existing.contains(descriptor.name())) {
        continue;
      }
      if (dryRun) {
        additions.add(new EnsuredPartition(descriptor.name(), EnsuredPartition.PLANNED));
        continue;
      }
      if (partitionCatalog.createPartition(policy.tableName(), descriptor)) {
        additions.add(new EnsuredPartition(descriptor.name(), EnsuredPartition.CREATED));
        partitions.add(descriptor);
        existing.add(descriptor.name());
        log.info("Created partition {} of {}", descriptor.name(), policy.tableName());
      } else {
        log.debug("Partition {} of {} already exists", descriptor.name(), policy.tableName());
      }
    }
    return additions;
  }

  List<ArchivedPartition> archiveExpiredPartitions(
      PartitionPolicy policy, List<PartitionDescriptor> partitions, boolean dryRun, String runId) {
    PartitionMetadata metadata = policy.metadata();
    int graceDays =
        metadata.archiveGraceDays() != null
            ? metadata.archiveGraceDays()
            : properties.archiveGraceDays();
    int minActive =
        metadata.minActivePartitions() != null
            ? metadata.minActivePartitions()
            : properties.minActivePartitions();
    LocalDate cutoff =
        LocalDate.now(clock).minusDays(Math.max(0, policy.retentionDays() + graceDays));

    List<PartitionDescriptor> ordered =
        partitions.stream().sorted(Comparator.comparing(PartitionDescriptor::start)).toList();
    int remaining = ordered.size();

    List<ArchivedPartition> results = new ArrayList<>();
    for (PartitionDescriptor partition : ordered) {
      if (remaining <= minActive) {
        break;
      }
      if (partition.end().isAfter(cutoff)) {
        continue;
      }
      ArchivedPartition outcome;
      try {
        outcome = archivePartition(policy, partition, dryRun, runId);
      } catch (RuntimeException e) {
        log.error(
            "Failed to archive partition {} of {} (run {})",
            partition.name(),
            policy.tableName(),
            runId,
            e);
        outcome = ArchivedPartition.of(partition, ArchiveStatus.FAILED, e.getMessage());
      }
      results.add(outcome);
      if (outcome.dropped() || outcome.status() == ArchiveStatus.PLANNED_DROP) {
        remaining--;
      } else if (outcome.status() == ArchiveStatus.PLANNED_ARCHIVE && !metadata.skipDrop()) {
        remaining--;
      }
    }
    return results;
  }

  private ArchivedPartition archivePartition(
      PartitionPolicy policy, PartitionDescriptor partition, boolean dryRun, String runId) {
    PartitionMetadata metadata = policy.metadata();
    if (metadata.manualApprovalRequired()) {
      log.warn(
          "Partition {} of {} requires manual approval; not archiving",
          partition.name(),
          policy.tableName());
      return ArchivedPartition.of(
          partition, ArchiveStatus.SKIPPED, ArchivedPartition.REASON_MANUAL_APPROVAL);
    }

    Optional<ArchiveRecord> existing =
        archiveRecordRepository.findByTableNameAndPartitionName(
            policy.tableName(), partition.name());
    if (existing.isPresent()) {
      return resumeArchivedPartition(policy, partition, existing.get(), dryRun, runId);
    }

    if (dryRun) {
      return ArchivedPartition.of(
          partition, ArchiveStatus.PLANNED_ARCHIVE, ArchivedPartition.REASON_RETENTION_ELAPSED);
    }

    ArchiveResult archive =
        archiveExporter.export(
            new ArchiveRequest(
                policy,
                partition,
                resolveBucket(metadata),
                metadata.archivePrefix() != null
                    ? metadata.archivePrefix()
                    : properties.archive().prefix(),
                metadata.archiveVisibility() != null
                    ? metadata.archiveVisibility()
                    : properties.archive().visibility(),
                runId));
    ArchiveRecord record =
        archiveRecordRepository
            .findById(archive.archiveId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Archive manifest " + archive.archiveId() + " not found after export"));
    publishPartitionEvent("PARTITION_ARCHIVED", policy, partition, record, runId);

    if (metadata.skipDrop()) {
      return ArchivedPartition.withArchive(
          partition, ArchiveStatus.ARCHIVED, ArchivedPartition.REASON_DROP_DISABLED, false, record);
    }
    drop(policy, partition, record, runId);
    log.info(
        "Archived and dropped partition {} of {} (run {})",
        partition.name(),
        policy.tableName(),
        runId);
    return ArchivedPartition.withArchive(partition, ArchiveStatus.ARCHIVED, null, true, record);
  }

  private ArchivedPartition resumeArchivedPartition(
      PartitionPolicy policy,
      PartitionDescriptor partition,
      ArchiveRecord record,
      boolean dryRun,
      String runId) {
    boolean skipDrop = policy.metadata().skipDrop();
    if (record.isDropped()) {
      return ArchivedPartition.of(
          partition, ArchiveStatus.SKIPPED, ArchivedPartition.REASON_ALREADY_DROPPED);
    }
    if (dryRun) {
      return ArchivedPartition.of(
          partition,
          skipDrop ? ArchiveStatus.ARCHIVED : ArchiveStatus.PLANNED_DROP,
          ArchivedPartition.REASON_ARCHIVE_PRESENT);
    }
    if (skipDrop) {
      return ArchivedPartition.withArchive(
          partition, ArchiveStatus.ARCHIVED, ArchivedPartition.REASON_DROP_DISABLED, false, record);
    }
    drop(policy, partition, record, runId);
    log.info(
        "Dropped partition {} of {} after confirming prior archive (run {})",
        partition.name(),
        policy.tableName(),
        runId);
    return ArchivedPartition.withArchive(
        partition, ArchiveStatus.DROPPED, ArchivedPartition.REASON_ARCHIVE_PRESENT, true, record);
  }

  private void drop(
      PartitionPolicy policy, PartitionDescriptor partition, ArchiveRecord record, String runId) {
    Instant droppedAt = clock.instant();
    try {
      dropTransaction.executeWithoutResult(
          status -> {
            partitionCatalog.dropPartition(policy.tableName(), partition.name());
            record.markDropped(droppedAt);
            archiveRecordRepository.save(record);
          });
    } catch (RuntimeException e) {
      record.markDropped(null);
      throw e;
    }
    publishPartitionEvent("PARTITION_DROPPED", policy, partition, record, runId);
  }

  private String resolveBucket(PartitionMetadata metadata) {
    if (metadata.archiveBucket() != null) {
      return metadata.archiveBucket();
    }
    String configured = properties.archive().bucket();
    return configured != null && !configured.isBlank() ? configured : s3Properties.bucketName();
  }

  private void publishPartitionEvent(
      String operation,
      PartitionPolicy policy,
      PartitionDescriptor partition,
      ArchiveRecord record,
      String runId) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("runId", runId);
    payload.put("policyId", policy.id());
    payload.put("partition", partition.name());
    payload.put("rangeStart", partition.start().toString());
    payload.put("rangeEnd", partition.end().toString());
    payload.put("bucket", record.getStorageBucket());
    payload.put("key", record.getStorageKey());
    payload.put("rowCount", record.getRowCount());
    payload.put("byteSize", record.getByteSize());
    payload.put("checksum", record.getChecksum());
    try {
      changeDataCaptureService.recordEvent(
          new ChangeEventRequest(
              ChangeEventRequest.DOMAIN_GOVERNANCE,
              policy.tableName(),
              partition.name(),
              operation,
              payload,
              false,
              runId));
    } catch (RuntimeException e) {
      log.error(
          "Failed to record {} event for partition {} of {}",
          operation,
          partition.name(),
          policy.tableName(),
          e);
    }
  }

  private void recordRotationAudit(PartitionRunSummary summary) {
    long failedPolicies =
        summary.results().stream()
            .filter(outcome -> PartitionPolicyOutcome.STATUS_FAILED.equals(outcome.status()))
            .count();
    long failedPartitions = summary.countArchived(ArchiveStatus.FAILED);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("runId", summary.runId());
    details.put("policies", summary.results().size());
    details.put("created", summary.countCreated());
    details.put("archived", summary.countArchived(ArchiveStatus.ARCHIVED));
    details.put("dropped", summary.countDropped());
    details.put("failedPolicies", failedPolicies);
    details.put("failedPartitions", failedPartitions);
    try {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("governance.data_partition.rotated")
              .entityType(RUN_ENTITY_TYPE)
              .entityId(UUID.fromString(summary.runId()))
              .severity(failedPolicies + failedPartitions > 0 ? "warning" : "notice")
              .details(details)
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to record audit event for partition rotation {}", summary.runId(), e);
    }
  }
}
