package io.b2mash.governance.retention;

import java.util.List;

/** All per-policy results of one {@code enforce} invocation, in policy order. */
public record RetentionRunSummary(
    String runId, RetentionMode mode, boolean dryRun, List<RetentionExecutionResult> results) {

  public RetentionRunSummary {
    results = results != null ? List.copyOf(results) : List.of();
  }

  public long countByStatus(RetentionStatus status) {
    return results.stream().filter(result -> result.status() == status).count();
  }

  public long totalAffectedRows() {
    return results.stream().mapToLong(RetentionExecutionResult::affectedRows).sum();
  }

  public long totalMatchedRows() {
    return results.stream().mapToLong(RetentionExecutionResult::preRunCount).sum();
  }

  public long residualCount() {
    return results.stream().filter(RetentionExecutionResult::isResidual).count();
  }

  public List<RetentionExecutionResult> failures() {
    return results.stream().filter(result -> result.status() == RetentionStatus.FAILED).toList();
  }
}
