package io.b2mash.governance.partition;

/**
 * Declarative rule for one time-partitioned table. Rows come from {@code data_partition_policies}
 * and are read-only to the engine.
 *
 * @param id policy id
 * @param tableName partitioned parent table
 * @param dateColumn partition key column, used to order and bound exports
 * @param strategy only {@value #STRATEGY_MONTHLY_RANGE} is supported
 * @param retentionDays age in days after which a partition may be archived
 * @param metadata per-policy overrides
 */
public record PartitionPolicy(
    Long id,
    String tableName,
    String dateColumn,
    String strategy,
    int retentionDays,
    PartitionMetadata metadata) {

  public static final String STRATEGY_MONTHLY_RANGE = "monthly_range";

  public PartitionPolicy {
    metadata = metadata != null ? metadata : PartitionMetadata.from(null);
  }

  public boolean isMonthlyRange() {
    return STRATEGY_MONTHLY_RANGE.equals(strategy);
  }
}
