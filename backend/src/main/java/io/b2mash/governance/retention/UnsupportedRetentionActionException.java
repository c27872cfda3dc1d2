package io.b2mash.governance.retention;

public class UnsupportedRetentionActionException extends RuntimeException {

  public UnsupportedRetentionActionException(String action) {
    super("Unsupported data retention action \"" + action + "\"");
  }
}
