package io.b2mash.governance.retention;

import java.util.Map;
import java.util.Optional;

/**
 * An active legal hold on a retention policy. Declared in the policy criteria either as {@code
 * "legalHold": true} or as {@code "legalHold": {"active": true, "reason": ..., "owner": ...}}.
 */
public record LegalHold(String reason, String owner) {

  static final String DEFAULT_REASON = "policy marked with legalHold criteria flag";

  static Optional<LegalHold> from(Object declaration) {
    if (Boolean.TRUE.equals(declaration)) {
      return Optional.of(new LegalHold(DEFAULT_REASON, null));
    }
    if (declaration instanceof Map<?, ?> hold && Boolean.TRUE.equals(hold.get("active"))) {
      Object reason = hold.get("reason");
      Object owner = hold.get("owner");
      return Optional.of(
          new LegalHold(
              reason != null ? reason.toString() : DEFAULT_REASON,
              owner != null ? owner.toString() : null));
    }
    return Optional.empty();
  }
}
