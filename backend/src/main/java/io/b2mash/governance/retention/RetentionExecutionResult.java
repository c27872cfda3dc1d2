package io.b2mash.governance.retention;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one policy within one run.
 *
 * @param policyId policy id
 * @param entityName policy entity
 * @param action raw action value of the policy
 * @param status outcome
 * @param affectedRows rows deleted or soft-deleted; for dry runs, rows that would be
 * @param preRunCount rows matching before any mutation
 * @param sampleIds bounded sample of matched ids
 * @param dryRun whether the policy ran without mutating
 * @param verification verification outcome; null when not executed or verification is disabled
 * @param reason strategy or legal hold reason
 * @param description policy description
 * @param context strategy context (or legal hold owner)
 * @param error failure message for failed results
 */
public record RetentionExecutionResult(
    Long policyId,
    String entityName,
    String action,
    RetentionStatus status,
    long affectedRows,
    long preRunCount,
    List<Object> sampleIds,
    boolean dryRun,
    VerificationOutcome verification,
    String reason,
    String description,
    Map<String, Object> context,
    String error) {

  public RetentionExecutionResult {
    sampleIds = sampleIds != null ? List.copyOf(sampleIds) : List.of();
    context = context != null ? context : Map.of();
  }

  static RetentionExecutionResult skipped(
      RetentionPolicy policy, RetentionStatus status, boolean dryRun) {
    return new RetentionExecutionResult(
        policy.id(),
        policy.entityName(),
        policy.action(),
        status,
        0,
        0,
        List.of(),
        dryRun,
        null,
        null,
        policy.description(),
        Map.of(),
        null);
  }

  static RetentionExecutionResult legalHold(RetentionPolicy policy, LegalHold hold) {
    var context = new LinkedHashMap<String, Object>();
    context.put("owner", hold.owner());
    return new RetentionExecutionResult(
        policy.id(),
        policy.entityName(),
        policy.action(),
        RetentionStatus.SKIPPED_LEGAL_HOLD,
        0,
        0,
        List.of(),
        true,
        null,
        hold.reason(),
        policy.description(),
        context,
        null);
  }

  static RetentionExecutionResult failed(RetentionPolicy policy, boolean dryRun, String error) {
    return new RetentionExecutionResult(
        policy.id(),
        policy.entityName(),
        policy.action(),
        RetentionStatus.FAILED,
        0,
        0,
        List.of(),
        dryRun,
        null,
        null,
        policy.description(),
        Map.of(),
        error);
  }

  public boolean isResidual() {
    return verification != null && verification.status() == VerificationStatus.RESIDUAL;
  }

  /** Flat representation used for change-notification payloads and audit details. */
  public Map<String, Object> toDetails() {
    var details = new LinkedHashMap<String, Object>();
    details.put("policyId", policyId);
    details.put("entityName", entityName);
    details.put("action", action);
    details.put("status", status.value());
    details.put("affectedRows", affectedRows);
    details.put("preRunCount", preRunCount);
    details.put("sampleIds", sampleIds);
    details.put("dryRun", dryRun);
    if (verification != null) {
      var verificationDetails = new LinkedHashMap<String, Object>();
      verificationDetails.put("status", verification.status().value());
      verificationDetails.put("remainingRows", verification.remainingRows());
      details.put("verification", verificationDetails);
    }
    details.put("reason", reason);
    details.put("description", description);
    details.put("context", context);
    if (error != null) {
      details.put("error", error);
    }
    return details;
  }
}
