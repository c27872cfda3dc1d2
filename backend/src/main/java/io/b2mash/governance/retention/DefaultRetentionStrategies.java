package io.b2mash.governance.retention;

import io.b2mash.governance.support.SqlIdentifiers;
import java.util.LinkedHashMap;
import java.util.Map;

/** Strategies for the entities the platform ships with. */
public final class DefaultRetentionStrategies {

  private static final String OLDER_THAN = " < now() - make_interval(days => :%s)";

  private DefaultRetentionStrategies() {}

  public static void registerAll(RetentionStrategyRegistry registry) {
    registry.register("user_sessions", DefaultRetentionStrategies::userSessions);
    registry.register(
        "user_email_verification_tokens",
        policy ->
            ageBased(
                policy,
                "user_email_verification_tokens",
                "expires_at",
                "trim expired verification tokens"));
    registry.register(
        "domain_events",
        policy ->
            ageBased(
                policy,
                "domain_events",
                "created_at",
                "purge domain audit events after retention window"));
    registry.register(
        "content_asset_events",
        policy ->
            ageBased(
                policy,
                "content_asset_events",
                "occurred_at",
                "remove aged asset telemetry events"));
    registry.register("communities", DefaultRetentionStrategies::communities);
  }

  static RetentionPlan userSessions(RetentionPolicy policy) {
    int staleLastUsedDays =
        intCriterion(policy.criteria(), "staleLastUsedDays", policy.retentionPeriodDays());
    boolean includeRevoked = !Boolean.FALSE.equals(policy.criteria().get("includeRevoked"));

    var selection =
        RetentionSelection.from("user_sessions")
            .where(
                "expires_at < now() OR last_used_at" + OLDER_THAN.formatted("staleDays"),
                "staleDays",
                staleLastUsedDays);
    if (!includeRevoked) {
      selection = selection.where("revoked_at IS NULL");
    }
    selection = selection.where("deleted_at IS NULL");

    var context = new LinkedHashMap<String, Object>();
    context.put("includeRevoked", includeRevoked);
    context.put("staleLastUsedDays", staleLastUsedDays);
    return new RetentionPlan(
        "id",
        selection,
        "remove refresh sessions after " + staleLastUsedDays + "-day inactivity or expiration",
        null,
        context);
  }

  static RetentionPlan communities(RetentionPolicy policy) {
    Object configuredColumn = policy.criteria().get("softDeleteColumn");
    String softDeleteColumn =
        SqlIdentifiers.requireValid(
            configuredColumn != null
                ? configuredColumn.toString()
                : RetentionPlan.DEFAULT_SOFT_DELETE_COLUMN);
    Object visibility = policy.criteria().get("visibility");

    var selection =
        RetentionSelection.from("communities")
            .where(SqlIdentifiers.quote(softDeleteColumn) + " IS NULL")
            .where(
                "updated_at" + OLDER_THAN.formatted("days"),
                "days",
                policy.retentionPeriodDays());
    if (visibility != null) {
      selection = selection.where("visibility = :visibility", "visibility", visibility.toString());
    }

    var context = new LinkedHashMap<String, Object>();
    context.put("visibility", visibility);
    return new RetentionPlan(
        "id",
        selection,
        "soft delete communities inactive for " + policy.retentionPeriodDays() + " days",
        softDeleteColumn,
        context);
  }

  private static RetentionPlan ageBased(
      RetentionPolicy policy, String table, String ageColumn, String reason) {
    var selection =
        RetentionSelection.from(table)
            .where(ageColumn + OLDER_THAN.formatted("days"), "days", policy.retentionPeriodDays());
    return RetentionPlan.of(selection, reason);
  }

  static int intCriterion(Map<String, Object> criteria, String key, int fallback) {
    Object value = criteria.get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Criterion " + key + " must be an integer but was '" + text + "'", e);
      }
    }
    return fallback;
  }
}
