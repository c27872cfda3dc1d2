package io.b2mash.governance.retention;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetentionStatus {
  EXECUTED("executed"),
  SKIPPED_INACTIVE("skipped-inactive"),
  SKIPPED_UNSUPPORTED("skipped-unsupported"),
  SKIPPED_LEGAL_HOLD("skipped-legal-hold"),
  FAILED("failed");

  private final String value;

  RetentionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
