package io.b2mash.governance.retention;

/** Raised when a committed policy affected at least the configured alert threshold of rows. */
public record RetentionAlert(
    String runId, RetentionPolicy policy, RetentionExecutionResult result, RetentionMode mode) {}
