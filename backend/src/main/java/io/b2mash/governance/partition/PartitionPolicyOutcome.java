package io.b2mash.governance.partition;

import java.util.List;

/**
 * Rotation outcome for one policy.
 *
 * @param status "ok", or "failed" when listing or provisioning partitions failed
 * @param error failure message; null unless failed
 */
public record PartitionPolicyOutcome(
    Long policyId,
    String tableName,
    List<EnsuredPartition> ensured,
    List<ArchivedPartition> archived,
    String status,
    String error) {

  public static final String STATUS_OK = "ok";
  public static final String STATUS_FAILED = "failed";

  public PartitionPolicyOutcome {
    ensured = ensured != null ? List.copyOf(ensured) : List.of();
    archived = archived != null ? List.copyOf(archived) : List.of();
  }
}
