package io.b2mash.governance.retention;

import io.b2mash.governance.support.SqlIdentifiers;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of the rows a retention policy targets: a table, a conjunction of SQL
 * predicates and the named parameters they bind. Every call to {@code where} returns a new
 * instance, so one selection can be counted, sampled and mutated repeatedly inside the same
 * transaction.
 */
public final class RetentionSelection {

  private final String table;
  private final List<String> predicates;
  private final Map<String, Object> params;

  private RetentionSelection(String table, List<String> predicates, Map<String, Object> params) {
    this.table = table;
    this.predicates = predicates;
    this.params = params;
  }

  public static RetentionSelection from(String table) {
    return new RetentionSelection(SqlIdentifiers.requireValid(table), List.of(), Map.of());
  }

  public RetentionSelection where(String predicate) {
    return where(predicate, Map.of());
  }

  public RetentionSelection where(String predicate, String paramName, Object paramValue) {
    return where(predicate, Collections.singletonMap(paramName, paramValue));
  }

  private RetentionSelection where(String predicate, Map<String, Object> extraParams) {
    if (predicate == null || predicate.isBlank()) {
      throw new IllegalArgumentException("Predicate cannot be empty");
    }
    var nextPredicates = new ArrayList<>(predicates);
    nextPredicates.add(predicate);
    var nextParams = new LinkedHashMap<>(params);
    extraParams.forEach(
        (name, value) -> {
          if (nextParams.containsKey(name)) {
            throw new IllegalArgumentException("Parameter bound twice: " + name);
          }
          nextParams.put(name, value);
        });
    return new RetentionSelection(
        table, List.copyOf(nextPredicates), Collections.unmodifiableMap(nextParams));
  }

  public String table() {
    return table;
  }

  public List<String> predicates() {
    return predicates;
  }

  public Map<String, Object> params() {
    return params;
  }

  /** Renders {@code FROM "table" WHERE (p1) AND (p2)}. */
  public String fromClause() {
    return "FROM " + SqlIdentifiers.quote(table) + whereClause();
  }

  /** Renders {@code  WHERE (p1) AND (p2)} with a leading space, or an empty string. */
  public String whereClause() {
    var sql = new StringBuilder();
    for (int i = 0; i < predicates.size(); i++) {
      sql.append(i == 0 ? " WHERE (" : " AND (").append(predicates.get(i)).append(')');
    }
    return sql.toString();
  }

  @Override
  public String toString() {
    return fromClause() + " " + params;
  }
}
