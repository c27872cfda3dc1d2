package io.b2mash.governance.partition;

import java.time.Instant;
import java.util.List;

/**
 * Result of one {@link PartitionRotationService#rotate(boolean)} call.
 *
 * @param status "completed", or "disabled" when partitioning is switched off
 */
public record PartitionRunSummary(
    String runId,
    boolean dryRun,
    String status,
    Instant executedAt,
    List<PartitionPolicyOutcome> results) {

  public static final String STATUS_COMPLETED = "completed";
  public static final String STATUS_DISABLED = "disabled";

  public PartitionRunSummary {
    results = results != null ? List.copyOf(results) : List.of();
  }

  public long countArchived(ArchiveStatus status) {
    return results.stream()
        .flatMap(outcome -> outcome.archived().stream())
        .filter(archived -> archived.status() == status)
        .count();
  }

  public long countDropped() {
    return results.stream()
        .flatMap(outcome -> outcome.archived().stream())
        .filter(ArchivedPartition::dropped)
        .count();
  }

  public long countCreated() {
    return results.stream()
        .flatMap(outcome -> outcome.ensured().stream())
        .filter(ensured -> EnsuredPartition.CREATED.equals(ensured.status()))
        .count();
  }
}
