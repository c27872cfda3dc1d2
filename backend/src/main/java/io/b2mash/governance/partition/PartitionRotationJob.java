package io.b2mash.governance.partition;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/** Runs {@link PartitionRotationService#rotate()} on the configured cron schedule. */
@Component
public class PartitionRotationJob implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(PartitionRotationJob.class);

  private final PartitionRotationService rotationService;
  private final PartitionProperties properties;
  private final TaskScheduler taskScheduler;
  private final Clock clock;

  private final AtomicBoolean rotationInProgress = new AtomicBoolean(false);
  private final Object lifecycleMonitor = new Object();

  private volatile boolean running;
  private ScheduledFuture<?> scheduledRuns;

  public PartitionRotationJob(
      PartitionRotationService rotationService,
      PartitionProperties properties,
      TaskScheduler taskScheduler,
      Clock clock) {
    this.rotationService = rotationService;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  @Override
  public void start() {
    synchronized (lifecycleMonitor) {
      if (running) {
        return;
      }
      ZoneId zone = resolveZone(properties.cron(), properties.timezone());
      running = true;
      if (!properties.enabled()) {
        log.info("Data partitioning disabled; no rotations scheduled");
        return;
      }
      scheduledRuns =
          taskScheduler.schedule(
              () -> runRotation("scheduled"), new CronTrigger(properties.cron(), zone));
      log.info(
          "Partition rotation scheduled: cron='{}' zone={} dryRun={}",
          properties.cron(),
          zone,
          properties.dryRun());
    }
    if (properties.runOnStartup()) {
      taskScheduler.schedule(() -> runRotation("startup"), clock.instant());
    }
  }

  @Override
  public void stop() {
    synchronized (lifecycleMonitor) {
      if (scheduledRuns != null) {
        scheduledRuns.cancel(false);
        scheduledRuns = null;
      }
      running = false;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Runs one rotation unless one is already in progress. Failures are logged, never thrown, so
   * the next scheduled run still happens.
   *
   * @return the run summary, or null when skipped or failed
   */
  public PartitionRunSummary runRotation(String trigger) {
    if (!rotationInProgress.compareAndSet(false, true)) {
      log.warn("Partition rotation already in progress; skipping {} run", trigger);
      return null;
    }
    try {
      log.info("Starting {} partition rotation", trigger);
      return rotationService.rotate();
    } catch (RuntimeException e) {
      log.error("Partition rotation ({}) failed", trigger, e);
      return null;
    } finally {
      rotationInProgress.set(false);
    }
  }

  static ZoneId resolveZone(String cron, String timezone) {
    if (cron == null || !CronExpression.isValidExpression(cron)) {
      throw new IllegalStateException("Invalid partition rotation cron expression: " + cron);
    }
    if (timezone == null || timezone.isBlank()) {
      throw new IllegalStateException("Partition rotation timezone is required");
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new IllegalStateException("Invalid partition rotation timezone: " + timezone, e);
    }
  }
}
