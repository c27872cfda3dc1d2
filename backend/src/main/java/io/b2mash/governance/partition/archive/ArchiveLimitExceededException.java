package io.b2mash.governance.partition.archive;

/** Raised when an export passes the configured row or byte ceiling. */
public class ArchiveLimitExceededException extends RuntimeException {

  public ArchiveLimitExceededException(String message) {
    super(message);
  }
}
