package io.b2mash.governance.retention;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the retention supervisor.
 *
 * @param enabled whether scheduled cycles do any work
 * @param cron six-field Spring cron expression
 * @param timezone zone the cron expression is evaluated in
 * @param dryRun run only the simulate pass
 * @param runOnStartup run one cycle as soon as the supervisor starts
 * @param maxConsecutiveFailures failures that trigger a pause
 * @param failureBackoffMinutes base pause length
 * @param backoffExponentBase growth factor per escalation
 * @param maxBackoffMinutes upper bound for the pause length
 * @param alertThreshold affected-row count that raises an anomaly
 * @param policyCacheRefreshInterval how long loaded policies stay fresh
 * @param singleWriterLock guard cycles with a database advisory lock
 * @param verification post-mutation verification settings
 */
@ConfigurationProperties(prefix = "governance.retention")
public record RetentionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("0 0 3 * * *") String cron,
    @DefaultValue("Etc/UTC") String timezone,
    @DefaultValue("false") boolean dryRun,
    @DefaultValue("false") boolean runOnStartup,
    @DefaultValue("3") int maxConsecutiveFailures,
    @DefaultValue("15") long failureBackoffMinutes,
    @DefaultValue("2") double backoffExponentBase,
    @DefaultValue("1440") long maxBackoffMinutes,
    @DefaultValue("500") long alertThreshold,
    @DefaultValue("5m") Duration policyCacheRefreshInterval,
    @DefaultValue("true") boolean singleWriterLock,
    @DefaultValue Verification verification) {

  public record Verification(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("true") boolean failOnResidual,
      @DefaultValue("5") int sampleSize) {

    public VerificationSettings toSettings() {
      return new VerificationSettings(enabled, failOnResidual, sampleSize);
    }
  }
}
