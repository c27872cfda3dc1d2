package io.b2mash.governance.retention;

import io.b2mash.governance.cdc.ChangeDataCaptureService;
import io.b2mash.governance.cdc.ChangeEventRequest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Executes retention policies. Policies run sequentially, each in its own {@code REQUIRES_NEW}
 * transaction, so a failing policy rolls back only its own work and never stops the run.
 *
 * <p>Residual rows after a committed mutation fail the policy but do not roll the mutation back;
 * the next run converges on the remaining rows.
 */
@Service
public class RetentionEnforcementService {

  private static final Logger log = LoggerFactory.getLogger(RetentionEnforcementService.class);

  static final String CDC_ENTITY = "data_retention_policy";

  private final RetentionStrategyRegistry strategyRegistry;
  private final RetentionPolicyRepository policyRepository;
  private final RetentionSelectionRepository selectionRepository;
  private final RetentionAuditLogRepository auditLogRepository;
  private final ChangeDataCaptureService changeDataCaptureService;
  private final TransactionTemplate policyTransaction;
  private final Clock clock;

  public RetentionEnforcementService(
      RetentionStrategyRegistry strategyRegistry,
      RetentionPolicyRepository policyRepository,
      RetentionSelectionRepository selectionRepository,
      RetentionAuditLogRepository auditLogRepository,
      ChangeDataCaptureService changeDataCaptureService,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.strategyRegistry = strategyRegistry;
    this.policyRepository = policyRepository;
    this.selectionRepository = selectionRepository;
    this.auditLogRepository = auditLogRepository;
    this.changeDataCaptureService = changeDataCaptureService;
    this.policyTransaction = new TransactionTemplate(transactionManager);
    this.policyTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  /**
   * Runs the given (or currently active) policies. Per-policy failures are reported in the
   * summary; only a failure to load policies propagates.
   */
  public RetentionRunSummary enforce(EnforcementOptions options) {
    RetentionMode mode = options.resolvedMode();
    boolean runDry = options.dryRun() || mode == RetentionMode.SIMULATE;
    String runId = UUID.randomUUID().toString();

    List<RetentionPolicy> policies =
        options.policies() != null ? options.policies() : policyRepository.findActive();

    log.info(
        "Starting data retention run {} mode={} dryRun={} policies={}",
        runId,
        mode.value(),
        runDry,
        policies.size());

    List<RetentionExecutionResult> results = new ArrayList<>(policies.size());
    for (RetentionPolicy policy : policies) {
      results.add(enforcePolicy(runId, policy, mode, runDry, options));
    }

    var summary = new RetentionRunSummary(runId, mode, runDry, results);
    log.info(
        "Data retention run {} finished: executed={}, failed={}, affectedRows={}",
        runId,
        summary.countByStatus(RetentionStatus.EXECUTED),
        summary.countByStatus(RetentionStatus.FAILED),
        summary.totalAffectedRows());
    return summary;
  }

  private RetentionExecutionResult enforcePolicy(
      String runId,
      RetentionPolicy policy,
      RetentionMode mode,
      boolean runDry,
      EnforcementOptions options) {
    if (!policy.active()) {
      return RetentionExecutionResult.skipped(policy, RetentionStatus.SKIPPED_INACTIVE, runDry);
    }

    var legalHold = policy.legalHold();
    if (legalHold.isPresent()) {
      log.warn(
          "Retention policy {} ({}) under legal hold; skipping enforcement",
          policy.id(),
          policy.entityName());
      var held = RetentionExecutionResult.legalHold(policy, legalHold.get());
      var details = new LinkedHashMap<String, Object>();
      details.put("reason", legalHold.get().reason());
      details.put("owner", legalHold.get().owner());
      publishEvent(runId, policy, held.status(), details, true, options.emitEvents());
      return held;
    }

    RetentionStrategy strategy = strategyRegistry.get(policy.entityName());
    if (strategy == null) {
      log.warn(
          "No data retention strategy registered for policy {} ({}); skipping",
          policy.id(),
          policy.entityName());
      return RetentionExecutionResult.skipped(policy, RetentionStatus.SKIPPED_UNSUPPORTED, runDry);
    }

    RetentionExecutionResult result;
    try {
      result =
          policyTransaction.execute(
              status -> execute(runId, policy, strategy, runDry, options.verification()));
    } catch (RuntimeException e) {
      log.error(
          "Failed to enforce data retention policy {} ({})", policy.id(), policy.entityName(), e);
      result = RetentionExecutionResult.failed(policy, runDry, e.getMessage());
    }

    publishEvent(runId, policy, result.status(), result.toDetails(), runDry, options.emitEvents());

    if (!runDry && options.onAlert() != null && result.affectedRows() >= options.alertThreshold()) {
      try {
        options.onAlert().onAlert(new RetentionAlert(runId, policy, result, mode));
      } catch (RuntimeException e) {
        log.error("Retention alert callback failed for policy {}", policy.id(), e);
      }
    }
    return result;
  }

  private RetentionExecutionResult execute(
      String runId,
      RetentionPolicy policy,
      RetentionStrategy strategy,
      boolean runDry,
      VerificationSettings verification) {
    RetentionPlan plan = strategy.plan(policy);
    if (RetentionAction.SOFT_DELETE.value().equals(policy.action())) {
      plan = plan.pendingSoftDelete();
    }
    List<Object> sampleIds = selectionRepository.sampleIds(plan, verification.sampleSize());

    if (sampleIds.isEmpty()) {
      log.info("No records matched retention policy {} ({})", policy.id(), policy.entityName());
      var verificationOutcome =
          runDry ? VerificationOutcome.simulated(0) : VerificationOutcome.of(0);
      var result =
          executed(
              policy,
              0,
              0,
              sampleIds,
              runDry,
              verificationOutcome,
              plan,
              RetentionStatus.EXECUTED,
              null);
      if (!runDry) {
        writeAuditLog(runId, policy, plan, result);
      }
      return result;
    }

    long preRunCount = selectionRepository.count(plan);
    if (runDry) {
      log.info(
          "Simulated retention policy {} ({}): {} rows match",
          policy.id(),
          policy.entityName(),
          preRunCount);
      return executed(
          policy,
          preRunCount,
          preRunCount,
          sampleIds,
          true,
          VerificationOutcome.simulated(preRunCount),
          plan,
          RetentionStatus.EXECUTED,
          null);
    }

    RetentionAction action = RetentionAction.fromValue(policy.action());
    int affectedRows =
        switch (action) {
          case HARD_DELETE -> selectionRepository.delete(plan);
          case SOFT_DELETE -> selectionRepository.softDelete(plan);
        };

    VerificationOutcome verificationOutcome = null;
    RetentionStatus status = RetentionStatus.EXECUTED;
    String error = null;
    if (verification.enabled()) {
      verificationOutcome = VerificationOutcome.of(selectionRepository.count(plan));
      if (verificationOutcome.status() == VerificationStatus.RESIDUAL) {
        log.warn(
            "Retention policy {} ({}) left {} matching rows after {}",
            policy.id(),
            policy.entityName(),
            verificationOutcome.remainingRows(),
            action.value());
        if (verification.failOnResidual()) {
          status = RetentionStatus.FAILED;
          error =
              verificationOutcome.remainingRows()
                  + " rows still match policy "
                  + policy.id()
                  + " after "
                  + action.value();
        }
      }
    }

    var result =
        executed(
            policy,
            affectedRows,
            preRunCount,
            sampleIds,
            false,
            verificationOutcome,
            plan,
            status,
            error);
    writeAuditLog(runId, policy, plan, result);
    log.info(
        "Retention policy {} ({}) enforced: action={}, affectedRows={}, status={}",
        policy.id(),
        policy.entityName(),
        action.value(),
        affectedRows,
        status.value());
    return result;
  }

  private static RetentionExecutionResult executed(
      RetentionPolicy policy,
      long affectedRows,
      long preRunCount,
      List<Object> sampleIds,
      boolean dryRun,
      VerificationOutcome verification,
      RetentionPlan plan,
      RetentionStatus status,
      String error) {
    return new RetentionExecutionResult(
        policy.id(),
        policy.entityName(),
        policy.action(),
        status,
        affectedRows,
        preRunCount,
        sampleIds,
        dryRun,
        verification,
        plan.reason(),
        policy.description(),
        plan.context(),
        error);
  }

  private void writeAuditLog(
      String runId, RetentionPolicy policy, RetentionPlan plan, RetentionExecutionResult result) {
    var details = new LinkedHashMap<String, Object>();
    details.put("reason", plan.reason());
    details.put("sampleIds", result.sampleIds());
    details.put("dryRun", false);
    details.put("runId", runId);
    details.put("matchedRows", result.preRunCount());
    details.put("affectedRows", result.affectedRows());
    if (result.verification() != null) {
      details.put("verification", result.toDetails().get("verification"));
    }
    details.put("context", plan.context());
    if (result.error() != null) {
      details.put("error", result.error());
    }
    auditLogRepository.save(
        new RetentionAuditLog(policy.id(), result.affectedRows(), details, clock.instant()));
  }

  private void publishEvent(
      String runId,
      RetentionPolicy policy,
      RetentionStatus status,
      Map<String, Object> details,
      boolean dryRun,
      boolean emitEvents) {
    if (!emitEvents) {
      return;
    }
    String operation =
        status == RetentionStatus.FAILED
            ? "RETENTION_FAILED"
            : dryRun ? "RETENTION_SIMULATED" : "RETENTION_ENFORCED";
    var payload = new LinkedHashMap<String, Object>();
    payload.put("runId", runId);
    payload.put("policyId", policy.id());
    payload.put("entityName", policy.entityName());
    payload.put("status", status.value());
    payload.put("details", details);
    try {
      changeDataCaptureService.recordEvent(
          new ChangeEventRequest(
              ChangeEventRequest.DOMAIN_GOVERNANCE,
              CDC_ENTITY,
              String.valueOf(policy.id()),
              operation,
              payload,
              dryRun,
              runId));
    } catch (RuntimeException e) {
      log.error(
          "Failed to record change event for retention policy {} status={}",
          policy.id(),
          status.value(),
          e);
    }
  }
}
