package io.b2mash.governance.retention;

import io.b2mash.governance.support.SqlIdentifiers;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Executes {@link RetentionPlan} selections against host tables. Runs in whatever transaction is
 * bound to the calling thread.
 */
@Repository
public class RetentionSelectionRepository {

  private final JdbcClient jdbc;

  public RetentionSelectionRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public List<Object> sampleIds(RetentionPlan plan, int limit) {
    String idColumn = SqlIdentifiers.quote(plan.idColumn());
    var params = new LinkedHashMap<>(plan.selection().params());
    params.put("sampleLimit", limit);
    return jdbc.sql(
            "SELECT "
                + idColumn
                + " "
                + plan.selection().fromClause()
                + " ORDER BY "
                + idColumn
                + " LIMIT :sampleLimit")
        .params(params)
        .query((rs, rowNum) -> rs.getObject(1))
        .list();
  }

  public long count(RetentionPlan plan) {
    Long total =
        jdbc.sql("SELECT count(*) " + plan.selection().fromClause())
            .params(plan.selection().params())
            .query(Long.class)
            .single();
    return total != null ? total : 0L;
  }

  public int delete(RetentionPlan plan) {
    return jdbc.sql("DELETE " + plan.selection().fromClause())
        .params(plan.selection().params())
        .update();
  }

  public int softDelete(RetentionPlan plan) {
    var pending = plan.pendingSoftDelete();
    var selection = pending.selection();
    return jdbc.sql(
            "UPDATE "
                + SqlIdentifiers.quote(selection.table())
                + " SET "
                + SqlIdentifiers.quote(pending.effectiveSoftDeleteColumn())
                + " = now()"
                + selection.whereClause())
        .params(selection.params())
        .update();
  }
}
