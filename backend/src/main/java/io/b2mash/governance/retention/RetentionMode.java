package io.b2mash.governance.retention;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RetentionMode {
  SIMULATE,
  COMMIT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
