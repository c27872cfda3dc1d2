package io.b2mash.governance.partition;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ArchiveStatus {
  SKIPPED("skipped"),
  PLANNED_DROP("planned-drop"),
  PLANNED_ARCHIVE("planned-archive"),
  ARCHIVED("archived"),
  DROPPED("dropped"),
  FAILED("failed");

  private final String value;

  ArchiveStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
