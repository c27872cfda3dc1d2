package io.b2mash.governance.partition;

import io.b2mash.governance.support.JsonMaps;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Reads partition policies from the configuration store. */
@Repository
public class PartitionPolicyRepository {

  private final JdbcClient jdbc;

  public PartitionPolicyRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public List<PartitionPolicy> findAll() {
    return jdbc.sql(
            """
            SELECT id, table_name, date_column, strategy, retention_days,
                   metadata::text AS metadata
            FROM data_partition_policies
            ORDER BY id
            """)
        .query(
            (rs, rowNum) ->
                new PartitionPolicy(
                    rs.getLong("id"),
                    rs.getString("table_name"),
                    rs.getString("date_column"),
                    rs.getString("strategy"),
                    rs.getInt("retention_days"),
                    PartitionMetadata.from(JsonMaps.parse(rs.getString("metadata")))))
        .list();
  }
}
