package io.b2mash.governance.retention.supervisor;

import io.b2mash.governance.audit.AuditEventBuilder;
import io.b2mash.governance.audit.AuditService;
import io.b2mash.governance.cdc.ChangeDataCaptureService;
import io.b2mash.governance.cdc.ChangeEventRequest;
import io.b2mash.governance.retention.EnforcementOptions;
import io.b2mash.governance.retention.RetentionAlert;
import io.b2mash.governance.retention.RetentionEnforcementService;
import io.b2mash.governance.retention.RetentionExecutionResult;
import io.b2mash.governance.retention.RetentionMode;
import io.b2mash.governance.retention.RetentionPolicy;
import io.b2mash.governance.retention.RetentionPolicyCache;
import io.b2mash.governance.retention.RetentionProperties;
import io.b2mash.governance.retention.RetentionRunSummary;
import io.b2mash.governance.retention.RetentionStatus;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Drives the retention engine on a cron schedule through simulate-then-commit cycles.
 *
 * <p>After {@code maxConsecutiveFailures} failed cycles the supervisor pauses for an
 * exponentially growing backoff window and persists a {@link ResumeApprovalGate}. Cycles stay
 * skipped, even after the window elapses, until an operator approves the gate's token. The
 * persisted gate is re-read on every attempt; the in-memory copy only covers a failed write.
 */
@Component
public class RetentionJobSupervisor implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RetentionJobSupervisor.class);

  static final String LOCK_NAME = "governance.data_retention.supervisor";
  static final String RUN_ENTITY_TYPE = "governance.data_retention_run";

  private final RetentionProperties properties;
  private final RetentionEnforcementService enforcementService;
  private final RetentionPolicyCache policyCache;
  private final ResumeApprovalGateStore gateStore;
  private final CycleLock cycleLock;
  private final RetentionMetrics metrics;
  private final AuditService auditService;
  private final ChangeDataCaptureService changeDataCaptureService;
  private final TaskScheduler taskScheduler;
  private final Clock clock;

  private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
  private final Object lifecycleMonitor = new Object();

  private volatile SupervisorState state = SupervisorState.IDLE;
  private volatile boolean running;
  private volatile Instant pausedUntil;
  private volatile ResumeApprovalGate pendingGate;
  private volatile RetentionRunSummary lastSummary;
  private volatile List<RetentionAlert> lastAnomalies = List.of();
  private volatile RetentionRunSummary lastSimulation;
  private int consecutiveFailures;
  private int escalations;
  private ScheduledFuture<?> scheduledCycles;

  public RetentionJobSupervisor(
      RetentionProperties properties,
      RetentionEnforcementService enforcementService,
      RetentionPolicyCache policyCache,
      ResumeApprovalGateStore gateStore,
      CycleLock cycleLock,
      RetentionMetrics metrics,
      AuditService auditService,
      ChangeDataCaptureService changeDataCaptureService,
      TaskScheduler taskScheduler,
      Clock clock) {
    this.properties = properties;
    this.enforcementService = enforcementService;
    this.policyCache = policyCache;
    this.gateStore = gateStore;
    this.cycleLock = cycleLock;
    this.metrics = metrics;
    this.auditService = auditService;
    this.changeDataCaptureService = changeDataCaptureService;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  /**
   * Validates the schedule, registers the cron trigger, warms the policy cache and optionally
   * queues one immediate cycle.
   *
   * @throws IllegalStateException if the cron expression or timezone is invalid
   */
  @Override
  public void start() {
    synchronized (lifecycleMonitor) {
      if (running) {
        return;
      }
      ZoneId zone = resolveSchedule(properties.cron(), properties.timezone());
      running = true;
      if (!properties.enabled()) {
        log.info("Data retention supervisor disabled; no cycles scheduled");
        return;
      }
      scheduledCycles =
          taskScheduler.schedule(
              () -> runScheduled("scheduled"), new CronTrigger(properties.cron(), zone));
      state = SupervisorState.SCHEDULED;
      log.info(
          "Data retention supervisor scheduled: cron='{}' zone={} dryRun={}",
          properties.cron(),
          zone,
          properties.dryRun());
    }

    try {
      policyCache.refresh(false);
    } catch (RuntimeException e) {
      log.warn("Failed to warm retention policy cache: {}", e.getMessage());
    }

    if (properties.runOnStartup()) {
      taskScheduler.schedule(() -> runScheduled("startup"), clock.instant());
    }
  }

  @Override
  public void stop() {
    synchronized (lifecycleMonitor) {
      if (scheduledCycles != null) {
        scheduledCycles.cancel(false);
        scheduledCycles = null;
        log.info("Data retention supervisor stopped");
      }
      running = false;
      if (state == SupervisorState.SCHEDULED) {
        state = SupervisorState.IDLE;
      }
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Runs one cycle immediately, outside the schedule. */
  public RetentionRunSummary runOnce() {
    return runCycle("manual");
  }

  /**
   * Runs one supervised cycle.
   *
   * @param trigger what started the cycle: "scheduled", "startup" or "manual"
   * @return the summary of the cycle, or null when the cycle was skipped
   * @throws RuntimeException the cycle's failure, after failure bookkeeping
   */
  public RetentionRunSummary runCycle(String trigger) {
    if (!properties.enabled()) {
      log.debug("Data retention supervisor disabled; skipping {} cycle", trigger);
      return null;
    }
    Instant now = clock.instant();
    Instant pauseEnd = pausedUntil;
    if (pauseEnd != null && now.isBefore(pauseEnd)) {
      log.warn("Data retention supervisor paused until {}; skipping {} cycle", pauseEnd, trigger);
      metrics.recordCycle("skipped-paused");
      return null;
    }
    if (!cycleInProgress.compareAndSet(false, true)) {
      log.warn("Data retention cycle already in progress; skipping {} cycle", trigger);
      return null;
    }
    try {
      GateDecision gate = checkResumeGate(now, trigger);
      if (gate == GateDecision.BLOCKED) {
        metrics.recordCycle("skipped-awaiting-approval");
        return null;
      }
      state = SupervisorState.RUNNING;
      Optional<RetentionRunSummary> outcome =
          cycleLock.runExclusively(LOCK_NAME, () -> executeCycle(trigger));
      if (outcome.isEmpty()) {
        log.warn("Another process holds the data retention lock; skipping {} cycle", trigger);
        metrics.recordCycle("skipped-locked");
        state = idleState();
        return null;
      }
      onSuccess(outcome.get(), trigger, gate == GateDecision.APPROVED);
      return outcome.get();
    } catch (RuntimeException e) {
      onFailure(e, trigger);
      throw e;
    } finally {
      cycleInProgress.set(false);
    }
  }

  private GateDecision checkResumeGate(Instant now, String trigger) {
    Optional<ResumeApprovalGate> stored;
    try {
      stored = gateStore.load();
    } catch (RuntimeException e) {
      log.warn(
          "Could not read retention resume gate; treating as not approved ({}): {}",
          trigger,
          e.getMessage());
      return GateDecision.BLOCKED;
    }

    ResumeApprovalGate remembered = pendingGate;
    if (stored.isEmpty() && remembered == null) {
      return GateDecision.OPEN;
    }
    if (stored.isEmpty()) {
      // The pause was never persisted; retry the write so an operator can approve it.
      gateStore.save(remembered);
      state = SupervisorState.AWAITING_RESUME_APPROVAL;
      log.warn("Retention resume gate missing from store; re-persisted token for approval");
      return GateDecision.BLOCKED;
    }

    ResumeApprovalGate gate = stored.get();
    if (gate.pausedUntil() != null && now.isBefore(gate.pausedUntil())) {
      pausedUntil = gate.pausedUntil();
      state = SupervisorState.PAUSED;
      log.warn(
          "Data retention supervisor paused until {}; skipping {} cycle", pausedUntil, trigger);
      return GateDecision.BLOCKED;
    }
    String expectedToken = remembered != null ? remembered.resumeToken() : gate.resumeToken();
    if (!gate.approves(expectedToken)) {
      state = SupervisorState.AWAITING_RESUME_APPROVAL;
      log.warn(
          "Data retention awaiting resume approval (paused at {}: {}); skipping {} cycle",
          gate.pausedAt(),
          gate.failureReason(),
          trigger);
      return GateDecision.BLOCKED;
    }
    log.info("Retention resume approved by {}; resuming cycles", gate.approvedBy());
    return GateDecision.APPROVED;
  }

  private RetentionRunSummary executeCycle(String trigger) {
    List<RetentionPolicy> policies = policyCache.listActivePolicies(false);
    if (policies.isEmpty()) {
      log.info("No active retention policies; nothing to enforce ({} cycle)", trigger);
      RetentionMode mode = properties.dryRun() ? RetentionMode.SIMULATE : RetentionMode.COMMIT;
      lastAnomalies = List.of();
      lastSimulation = null;
      return new RetentionRunSummary(
          UUID.randomUUID().toString(), mode, properties.dryRun(), List.of());
    }

    List<RetentionAlert> anomalies = Collections.synchronizedList(new ArrayList<>());
    RetentionRunSummary simulation =
        enforcementService.enforce(
            baseOptions(policies)
                .mode(RetentionMode.SIMULATE)
                .dryRun(true)
                .emitEvents(properties.dryRun())
                .build());

    if (properties.dryRun()) {
      for (RetentionExecutionResult result : simulation.results()) {
        if (result.affectedRows() >= properties.alertThreshold()) {
          var alert =
              new RetentionAlert(
                  simulation.runId(), findPolicy(policies, result), result, RetentionMode.SIMULATE);
          anomalies.add(alert);
          raiseAnomaly(alert);
        }
      }
      lastAnomalies = List.copyOf(anomalies);
      lastSimulation = null;
      return simulation;
    }
    lastSimulation = simulation;
    log.info(
        "Retention simulate pass {} matched {} rows across {} policies; committing",
        simulation.runId(),
        simulation.totalMatchedRows(),
        simulation.results().size());

    RetentionRunSummary commit =
        enforcementService.enforce(
            baseOptions(policies)
                .mode(RetentionMode.COMMIT)
                .onAlert(
                    alert -> {
                      anomalies.add(alert);
                      raiseAnomaly(alert);
                    })
                .build());
    lastAnomalies = List.copyOf(anomalies);
    return commit;
  }

  private EnforcementOptions.Builder baseOptions(List<RetentionPolicy> policies) {
    return EnforcementOptions.builder()
        .policies(policies)
        .alertThreshold(properties.alertThreshold())
        .verification(properties.verification().toSettings());
  }

  private static RetentionPolicy findPolicy(
      List<RetentionPolicy> policies, RetentionExecutionResult result) {
    return policies.stream()
        .filter(policy -> Objects.equals(policy.id(), result.policyId()))
        .findFirst()
        .orElse(null);
  }

  private void raiseAnomaly(RetentionAlert alert) {
    log.warn(
        "Retention anomaly in run {}: policy {} ({}) affected {} rows (threshold {}, mode {})",
        alert.runId(),
        alert.result().policyId(),
        alert.result().entityName(),
        alert.result().affectedRows(),
        properties.alertThreshold(),
        alert.mode().value());
    var payload = new LinkedHashMap<String, Object>();
    payload.put("runId", alert.runId());
    payload.put("policyId", alert.result().policyId());
    payload.put("entityName", alert.result().entityName());
    payload.put("affectedRows", alert.result().affectedRows());
    payload.put("threshold", properties.alertThreshold());
    payload.put("mode", alert.mode().value());
    try {
      changeDataCaptureService.recordEvent(
          new ChangeEventRequest(
              ChangeEventRequest.DOMAIN_GOVERNANCE,
              "data_retention_policy",
              String.valueOf(alert.result().policyId()),
              "RETENTION_ANOMALY",
              payload,
              alert.mode() == RetentionMode.SIMULATE,
              alert.runId()));
    } catch (RuntimeException e) {
      log.error("Failed to record retention anomaly event for run {}", alert.runId(), e);
    }
  }

  private synchronized void onSuccess(
      RetentionRunSummary summary, String trigger, boolean gateWasPersisted) {
    consecutiveFailures = 0;
    escalations = 0;
    pausedUntil = null;
    if (gateWasPersisted || pendingGate != null) {
      gateStore.clear();
    }
    pendingGate = null;
    lastSummary = summary;
    state = idleState();

    Instant completedAt = clock.instant();
    metrics.recordRun(summary, completedAt);
    metrics.recordCycle("success");
    metrics.updateSupervisorState(0, false);
    log.info(
        "Data retention {} cycle {} completed: mode={}, policies={}, affectedRows={}, anomalies={}",
        trigger,
        summary.runId(),
        summary.mode().value(),
        summary.results().size(),
        summary.totalAffectedRows(),
        lastAnomalies.size());
    if (!summary.results().isEmpty()) {
      reportRun(summary, trigger);
    }
  }

  private synchronized void onFailure(RuntimeException failure, String trigger) {
    consecutiveFailures++;
    metrics.recordCycle("failure");
    log.error(
        "Data retention {} cycle failed ({} consecutive)", trigger, consecutiveFailures, failure);

    if (consecutiveFailures < properties.maxConsecutiveFailures()) {
      state = idleState();
      metrics.updateSupervisorState(consecutiveFailures, false);
      return;
    }

    Instant now = clock.instant();
    Duration pause = backoffFor(escalations);
    pausedUntil = now.plus(pause);
    consecutiveFailures = 0;
    escalations++;
    var gate =
        ResumeApprovalGate.paused(
            UUID.randomUUID().toString(), now, pausedUntil, failure.getMessage());
    pendingGate = gate;
    gateStore.save(gate);
    state = SupervisorState.PAUSED;
    metrics.updateSupervisorState(0, true);
    log.error(
        "Data retention supervisor paused for {} minutes until {} (escalation {}); resume requires"
            + " approval",
        pause.toMinutes(),
        pausedUntil,
        escalations);
  }

  Duration backoffFor(int escalation) {
    double minutes =
        properties.failureBackoffMinutes() * Math.pow(properties.backoffExponentBase(), escalation);
    long bounded = (long) Math.min(minutes, properties.maxBackoffMinutes());
    return Duration.ofMinutes(bounded);
  }

  private void reportRun(RetentionRunSummary summary, String trigger) {
    List<RetentionExecutionResult> failures = summary.failures();
    long residual = summary.residualCount();
    String severity =
        summary.dryRun() ? "info" : (!failures.isEmpty() || residual > 0) ? "warning" : "notice";

    var totals = new LinkedHashMap<String, Object>();
    totals.put("runId", summary.runId());
    totals.put("trigger", trigger);
    totals.put("mode", summary.mode().value());
    totals.put("dryRun", summary.dryRun());
    totals.put("policies", summary.results().size());
    totals.put("executed", summary.countByStatus(RetentionStatus.EXECUTED));
    totals.put("failed", failures.size());
    totals.put("affectedRows", summary.totalAffectedRows());
    totals.put("matchedRows", summary.totalMatchedRows());
    totals.put("residualPolicies", residual);
    totals.put("anomalies", lastAnomalies.size());
    RetentionRunSummary simulation = lastSimulation;
    if (!summary.dryRun() && simulation != null) {
      Map<String, Object> simulated = new LinkedHashMap<>();
      simulated.put("runId", simulation.runId());
      simulated.put("policies", simulation.results().size());
      simulated.put("matchedRows", simulation.totalMatchedRows());
      simulated.put("failed", simulation.failures().size());
      totals.put("simulation", simulated);
    }
    totals.put(
        "failures",
        failures.stream()
            .map(
                failure -> {
                  Map<String, Object> entry = new LinkedHashMap<>();
                  entry.put("policyId", failure.policyId());
                  entry.put("entityName", failure.entityName());
                  entry.put("error", failure.error());
                  return entry;
                })
            .toList());

    try {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType(
                  summary.dryRun()
                      ? "governance.data_retention.simulated"
                      : "governance.data_retention.completed")
              .entityType(RUN_ENTITY_TYPE)
              .entityId(UUID.fromString(summary.runId()))
              .source(trigger)
              .severity(severity)
              .details(totals)
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to record audit event for retention run {}", summary.runId(), e);
    }

    try {
      changeDataCaptureService.recordEvent(
          new ChangeEventRequest(
              ChangeEventRequest.DOMAIN_GOVERNANCE,
              "data_retention_run",
              summary.runId(),
              "RETENTION_RUN_COMPLETED",
              totals,
              summary.dryRun(),
              summary.runId()));
    } catch (RuntimeException e) {
      log.error("Failed to record run completion event for retention run {}", summary.runId(), e);
    }
  }

  private void runScheduled(String trigger) {
    try {
      runCycle(trigger);
    } catch (RuntimeException e) {
      // already logged and counted by runCycle
      log.debug("Scheduled data retention cycle ended with failure: {}", e.getMessage());
    }
  }

  private SupervisorState idleState() {
    return scheduledCycles != null ? SupervisorState.SCHEDULED : SupervisorState.IDLE;
  }

  static ZoneId resolveSchedule(String cron, String timezone) {
    if (cron == null || !CronExpression.isValidExpression(cron)) {
      throw new IllegalStateException("Invalid data retention cron expression: " + cron);
    }
    if (timezone == null || timezone.isBlank()) {
      throw new IllegalStateException("Data retention timezone is required");
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new IllegalStateException("Invalid data retention timezone: " + timezone, e);
    }
  }

  private enum GateDecision {
    OPEN,
    APPROVED,
    BLOCKED
  }

  public SupervisorState getState() {
    return state;
  }

  public Instant getPausedUntil() {
    return pausedUntil;
  }

  public synchronized int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public synchronized int getEscalations() {
    return escalations;
  }

  public RetentionRunSummary getLastSummary() {
    return lastSummary;
  }

  public List<RetentionAlert> getLastAnomalies() {
    return lastAnomalies;
  }
}
