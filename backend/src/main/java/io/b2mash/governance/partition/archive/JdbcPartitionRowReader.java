package io.b2mash.governance.partition.archive;

import io.b2mash.governance.partition.PartitionDescriptor;
import io.b2mash.governance.partition.PartitionPolicy;
import io.b2mash.governance.partition.PartitionProperties;
import io.b2mash.governance.support.SqlIdentifiers;
import java.util.Map;
import java.util.function.Consumer;
import javax.sql.DataSource;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Cursor-based row streaming. PostgreSQL only honours the fetch size inside a transaction, so
 * each export runs in a read-only one.
 */
@Repository
public class JdbcPartitionRowReader implements PartitionRowReader {

  private final JdbcTemplate streamingJdbc;
  private final TransactionTemplate readOnlyTransaction;
  private final ColumnMapRowMapper rowMapper = new ColumnMapRowMapper();

  public JdbcPartitionRowReader(
      DataSource dataSource,
      PlatformTransactionManager transactionManager,
      PartitionProperties properties) {
    this.streamingJdbc = new JdbcTemplate(dataSource);
    this.streamingJdbc.setFetchSize(Math.max(1, properties.exportBatchSize()));
    this.readOnlyTransaction = new TransactionTemplate(transactionManager);
    this.readOnlyTransaction.setReadOnly(true);
  }

  @Override
  public void streamRows(
      PartitionPolicy policy,
      PartitionDescriptor partition,
      Consumer<Map<String, Object>> consumer) {
    String column = SqlIdentifiers.quote(policy.dateColumn());
    String sql =
        "SELECT * FROM "
            + SqlIdentifiers.quote(policy.tableName())
            + " WHERE "
            + column
            + " >= ? AND "
            + column
            + " < ? ORDER BY "
            + column;
    readOnlyTransaction.executeWithoutResult(
        status -> {
          int[] rowNum = {0};
          streamingJdbc.query(
              sql,
              rs -> {
                consumer.accept(rowMapper.mapRow(rs, rowNum[0]++));
              },
              partition.start(),
              partition.end());
        });
  }
}
