package io.b2mash.governance.retention;

import java.util.List;

/**
 * Options for {@link RetentionEnforcementService#enforce(EnforcementOptions)}.
 *
 * @param dryRun never mutate
 * @param mode explicit mode; null derives it from {@code dryRun}
 * @param policies policies to run; null loads the active policies from the configuration store
 * @param alertThreshold affected-row count that triggers {@code onAlert}
 * @param onAlert alert callback; nullable
 * @param verification verification settings
 * @param emitEvents whether per-policy change notifications are recorded
 */
public record EnforcementOptions(
    boolean dryRun,
    RetentionMode mode,
    List<RetentionPolicy> policies,
    long alertThreshold,
    RetentionAlertListener onAlert,
    VerificationSettings verification,
    boolean emitEvents) {

  public static final long DEFAULT_ALERT_THRESHOLD = 500;

  public EnforcementOptions {
    verification = verification != null ? verification : VerificationSettings.defaults();
  }

  public static Builder builder() {
    return new Builder();
  }

  RetentionMode resolvedMode() {
    if (mode != null) {
      return mode;
    }
    return dryRun ? RetentionMode.SIMULATE : RetentionMode.COMMIT;
  }

  public static final class Builder {

    private boolean dryRun;
    private RetentionMode mode;
    private List<RetentionPolicy> policies;
    private long alertThreshold = DEFAULT_ALERT_THRESHOLD;
    private RetentionAlertListener onAlert;
    private VerificationSettings verification = VerificationSettings.defaults();
    private boolean emitEvents = true;

    private Builder() {}

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder mode(RetentionMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder policies(List<RetentionPolicy> policies) {
      this.policies = policies;
      return this;
    }

    public Builder alertThreshold(long alertThreshold) {
      this.alertThreshold = alertThreshold;
      return this;
    }

    public Builder onAlert(RetentionAlertListener onAlert) {
      this.onAlert = onAlert;
      return this;
    }

    public Builder verification(VerificationSettings verification) {
      this.verification = verification;
      return this;
    }

    public Builder emitEvents(boolean emitEvents) {
      this.emitEvents = emitEvents;
      return this;
    }

    public EnforcementOptions build() {
      return new EnforcementOptions(
          dryRun, mode, policies, alertThreshold, onAlert, verification, emitEvents);
    }
  }
}
