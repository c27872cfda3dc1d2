package io.b2mash.governance.retention;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationStatus {
  /** Dry run; nothing was mutated. */
  SIMULATED("simulated"),
  /** No matching rows remain after the mutation. */
  CLEARED("cleared"),
  /** Matching rows remain after the mutation. */
  RESIDUAL("residual");

  private final String value;

  VerificationStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
