package io.b2mash.governance.retention.supervisor;

import io.b2mash.governance.retention.RetentionExecutionResult;
import io.b2mash.governance.retention.RetentionRunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class RetentionMetrics {

  static final String METRIC_POLICIES_PROCESSED = "governance.retention.policies.processed";
  static final String METRIC_AFFECTED_ROWS = "governance.retention.affected.rows";
  static final String METRIC_CYCLES = "governance.retention.cycles";
  static final String METRIC_LAST_RUN = "governance.retention.last.run.timestamp";
  static final String METRIC_CONSECUTIVE_FAILURES = "governance.retention.consecutive.failures";
  static final String METRIC_PAUSED = "governance.retention.paused";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> policyCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> cycleCounters = new ConcurrentHashMap<>();
  private final Counter affectedRows;
  private final AtomicLong lastRunEpochSeconds = new AtomicLong(0);
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
  private final AtomicInteger paused = new AtomicInteger(0);

  public RetentionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.affectedRows =
        Counter.builder(METRIC_AFFECTED_ROWS)
            .description("Rows deleted or soft-deleted by committed retention runs")
            .register(meterRegistry);
    Gauge.builder(METRIC_LAST_RUN, lastRunEpochSeconds, AtomicLong::get)
        .description("Epoch seconds of the last successful retention cycle")
        .register(meterRegistry);
    Gauge.builder(METRIC_CONSECUTIVE_FAILURES, consecutiveFailures, AtomicInteger::get)
        .description("Consecutive failed retention cycles")
        .register(meterRegistry);
    Gauge.builder(METRIC_PAUSED, paused, AtomicInteger::get)
        .description("1 while the retention supervisor is paused")
        .register(meterRegistry);
  }

  public void recordRun(RetentionRunSummary summary, Instant completedAt) {
    for (RetentionExecutionResult result : summary.results()) {
      policyCounter(result.status().value(), summary.mode().value()).increment();
    }
    if (!summary.dryRun()) {
      affectedRows.increment(summary.totalAffectedRows());
    }
    lastRunEpochSeconds.set(completedAt.getEpochSecond());
  }

  public void recordCycle(String outcome) {
    cycleCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_CYCLES)
                    .description("Retention supervisor cycles by outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void updateSupervisorState(int failures, boolean isPaused) {
    consecutiveFailures.set(Math.max(failures, 0));
    paused.set(isPaused ? 1 : 0);
  }

  private Counter policyCounter(String status, String mode) {
    return policyCounters.computeIfAbsent(
        status + ":" + mode,
        ignored ->
            Counter.builder(METRIC_POLICIES_PROCESSED)
                .description("Retention policies processed by status and mode")
                .tags(Tags.of("status", status, "mode", mode))
                .register(meterRegistry));
  }
}
