package io.b2mash.governance.retention;

import io.b2mash.governance.support.JsonMaps;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Reads retention policies from the configuration store. */
@Repository
public class RetentionPolicyRepository {

  private final JdbcClient jdbc;

  public RetentionPolicyRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public List<RetentionPolicy> findActive() {
    return jdbc.sql(
            """
            SELECT id, entity_name, action, retention_period_days, description,
                   criteria::text AS criteria, active
            FROM data_retention_policies
            WHERE active = true
            ORDER BY id
            """)
        .query(RetentionPolicyRepository::mapRow)
        .list();
  }

  private static RetentionPolicy mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RetentionPolicy(
        rs.getLong("id"),
        rs.getString("entity_name"),
        rs.getString("action"),
        rs.getInt("retention_period_days"),
        rs.getString("description"),
        JsonMaps.parse(rs.getString("criteria")),
        rs.getBoolean("active"));
  }
}
