package io.b2mash.governance.retention;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A declarative rule for aging rows of one entity out of the store. Rows come from the {@code
 * data_retention_policies} table and are read-only to the engine.
 *
 * @param id policy id
 * @param entityName registry key of the strategy that selects the rows
 * @param action raw action value; "hard-delete" and "soft-delete" are supported
 * @param retentionPeriodDays age threshold in days
 * @param description free-text description; nullable
 * @param criteria per-entity parameters, never null
 * @param active inactive policies are reported but never executed
 */
public record RetentionPolicy(
    Long id,
    String entityName,
    String action,
    int retentionPeriodDays,
    String description,
    Map<String, Object> criteria,
    boolean active) {

  public RetentionPolicy {
    criteria = criteria != null ? Map.copyOf(withoutNullValues(criteria)) : Map.of();
  }

  /** Returns the legal hold declared in {@code criteria.legalHold}, if it is active. */
  public Optional<LegalHold> legalHold() {
    return LegalHold.from(criteria.get("legalHold"));
  }

  private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
    var copy = new LinkedHashMap<String, Object>();
    source.forEach(
        (key, value) -> {
          if (value != null) {
            copy.put(key, value);
          }
        });
    return copy;
  }
}
