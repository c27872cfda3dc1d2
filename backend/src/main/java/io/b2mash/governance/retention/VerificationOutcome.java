package io.b2mash.governance.retention;

public record VerificationOutcome(VerificationStatus status, long remainingRows) {

  public static VerificationOutcome simulated(long remainingRows) {
    return new VerificationOutcome(VerificationStatus.SIMULATED, remainingRows);
  }

  public static VerificationOutcome of(long remainingRows) {
    return new VerificationOutcome(
        remainingRows == 0 ? VerificationStatus.CLEARED : VerificationStatus.RESIDUAL,
        remainingRows);
  }
}
