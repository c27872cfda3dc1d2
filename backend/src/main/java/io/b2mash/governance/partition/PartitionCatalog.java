package io.b2mash.governance.partition;

import java.util.List;

/** Physical partition operations on the relational store. */
public interface PartitionCatalog {

  /** Range partitions of the table, excluding the default (catch-all) partition. */
  List<PartitionDescriptor> listPartitions(String tableName);

  /**
   * Creates the partition.
   *
   * @return false when a partition with the same name already exists
   */
  boolean createPartition(String tableName, PartitionDescriptor descriptor);

  /** Drops the partition; a partition that no longer exists is not an error. */
  void dropPartition(String tableName, String partitionName);
}
