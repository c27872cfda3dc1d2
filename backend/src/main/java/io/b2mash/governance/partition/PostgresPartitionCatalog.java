package io.b2mash.governance.partition;

import io.b2mash.governance.support.SqlIdentifiers;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * {@link PartitionCatalog} for PostgreSQL declarative range partitioning. Monthly partitions are
 * named {@code <table>_pYYYYMM}; partitions with other names are decoded from their bound
 * expression and addressed by their relation name.
 */
@Repository
public class PostgresPartitionCatalog implements PartitionCatalog {

  private static final Logger log = LoggerFactory.getLogger(PostgresPartitionCatalog.class);

  private static final String DUPLICATE_TABLE = "42P07";
  private static final Pattern RANGE_BOUND =
      Pattern.compile(
          "FOR VALUES FROM \\('(\\d{4}-\\d{2}-\\d{2})[^']*'\\)"
              + " TO \\('(\\d{4}-\\d{2}-\\d{2})[^']*'\\)");

  private final JdbcClient jdbc;

  public PostgresPartitionCatalog(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<PartitionDescriptor> listPartitions(String tableName) {
    String table = SqlIdentifiers.requireValid(tableName);
    List<PartitionRow> rows =
        jdbc.sql(
                """
                SELECT child.relname AS partition_name,
                       pg_get_expr(child.relpartbound, child.oid) AS bound
                FROM pg_inherits inh
                JOIN pg_class parent ON parent.oid = inh.inhparent
                JOIN pg_class child ON child.oid = inh.inhrelid
                JOIN pg_namespace ns ON ns.oid = parent.relnamespace
                WHERE parent.relname = :table
                  AND ns.nspname = current_schema()
                ORDER BY child.relname
                """)
            .param("table", table)
            .query(
                (rs, rowNum) ->
                    new PartitionRow(rs.getString("partition_name"), rs.getString("bound")))
            .list();

    List<PartitionDescriptor> partitions = new ArrayList<>();
    for (PartitionRow row : rows) {
      if (row.bound() == null || "DEFAULT".equalsIgnoreCase(row.bound().trim())) {
        continue;
      }
      var descriptor = toDescriptor(table, row);
      if (descriptor.isPresent()) {
        partitions.add(descriptor.get());
      } else {
        log.debug("Ignoring partition {} of {} with bound {}", row.name(), table, row.bound());
      }
    }
    return partitions;
  }

  @Override
  public boolean createPartition(String tableName, PartitionDescriptor descriptor) {
    String table = SqlIdentifiers.requireValid(tableName);
    String sql =
        "CREATE TABLE %s PARTITION OF %s FOR VALUES FROM ('%s') TO ('%s')"
            .formatted(
                SqlIdentifiers.quote(relationName(table, descriptor.name())),
                SqlIdentifiers.quote(table),
                descriptor.start(),
                descriptor.end());
    try {
      jdbc.sql(sql).update();
      return true;
    } catch (DataAccessException e) {
      if (e.getMostSpecificCause() instanceof SQLException sqlException
          && DUPLICATE_TABLE.equals(sqlException.getSQLState())) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public void dropPartition(String tableName, String partitionName) {
    String table = SqlIdentifiers.requireValid(tableName);
    jdbc.sql("DROP TABLE IF EXISTS " + SqlIdentifiers.quote(relationName(table, partitionName)))
        .update();
  }

  static String relationName(String table, String partitionName) {
    return PartitionDescriptor.isMonthlyLabel(partitionName)
        ? table + "_" + partitionName
        : partitionName;
  }

  private static Optional<PartitionDescriptor> toDescriptor(String table, PartitionRow row) {
    String prefix = table + "_";
    if (row.name().startsWith(prefix)) {
      var decoded = PartitionDescriptor.decode(row.name().substring(prefix.length()));
      if (decoded.isPresent()) {
        return decoded;
      }
    }
    var matcher = RANGE_BOUND.matcher(row.bound());
    if (matcher.find()) {
      return Optional.of(
          new PartitionDescriptor(
              row.name(), LocalDate.parse(matcher.group(1)), LocalDate.parse(matcher.group(2))));
    }
    return Optional.empty();
  }

  private record PartitionRow(String name, String bound) {}
}
