package io.b2mash.governance.retention;

import io.b2mash.governance.support.SqlIdentifiers;
import java.util.Map;

/**
 * What a {@link RetentionStrategy} produces for one policy.
 *
 * @param idColumn column sampled for the audit trail
 * @param selection the rows to age out
 * @param reason human-readable reason recorded in the audit log
 * @param softDeleteColumn column set to now() by soft deletes; null means {@code deleted_at}
 * @param context strategy parameters echoed into results and audit rows
 */
public record RetentionPlan(
    String idColumn,
    RetentionSelection selection,
    String reason,
    String softDeleteColumn,
    Map<String, Object> context) {

  public static final String DEFAULT_ID_COLUMN = "id";
  public static final String DEFAULT_SOFT_DELETE_COLUMN = "deleted_at";

  public RetentionPlan {
    if (selection == null) {
      throw new IllegalArgumentException("Retention plan requires a selection");
    }
    idColumn = idColumn != null ? idColumn : DEFAULT_ID_COLUMN;
    context = context != null ? context : Map.of();
  }

  public static RetentionPlan of(RetentionSelection selection, String reason) {
    return new RetentionPlan(null, selection, reason, null, Map.of());
  }

  public String effectiveSoftDeleteColumn() {
    return softDeleteColumn != null ? softDeleteColumn : DEFAULT_SOFT_DELETE_COLUMN;
  }

  /**
   * Narrows the selection to rows whose soft-delete column is still null, so a soft delete never
   * re-stamps rows it already aged out and the post-run recount reflects only pending rows.
   */
  public RetentionPlan pendingSoftDelete() {
    String guard = SqlIdentifiers.quote(effectiveSoftDeleteColumn()) + " IS NULL";
    if (selection.predicates().contains(guard)) {
      return this;
    }
    return new RetentionPlan(idColumn, selection.where(guard), reason, softDeleteColumn, context);
  }
}
