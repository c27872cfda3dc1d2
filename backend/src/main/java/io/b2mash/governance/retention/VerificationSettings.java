package io.b2mash.governance.retention;

/**
 * Post-mutation verification switches.
 *
 * @param enabled re-count matching rows after the mutation
 * @param failOnResidual mark the policy failed when rows remain
 * @param sampleSize number of matching ids captured for the audit trail, capped at {@link
 *     #MAX_SAMPLE_SIZE}
 */
public record VerificationSettings(boolean enabled, boolean failOnResidual, int sampleSize) {

  public static final int DEFAULT_SAMPLE_SIZE = 5;
  public static final int MAX_SAMPLE_SIZE = 500;

  public VerificationSettings {
    if (sampleSize <= 0) {
      sampleSize = DEFAULT_SAMPLE_SIZE;
    }
    sampleSize = Math.min(sampleSize, MAX_SAMPLE_SIZE);
  }

  public static VerificationSettings defaults() {
    return new VerificationSettings(true, true, DEFAULT_SAMPLE_SIZE);
  }
}
