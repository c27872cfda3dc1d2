package io.b2mash.governance.retention;

public enum RetentionAction {
  HARD_DELETE("hard-delete"),
  SOFT_DELETE("soft-delete");

  private final String value;

  RetentionAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolves a configured action value.
   *
   * @throws UnsupportedRetentionActionException for any value other than the supported ones
   */
  public static RetentionAction fromValue(String value) {
    for (RetentionAction action : values()) {
      if (action.value.equals(value)) {
        return action;
      }
    }
    throw new UnsupportedRetentionActionException(value);
  }
}
