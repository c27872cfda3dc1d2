package io.b2mash.governance.partition.archive;

import io.b2mash.governance.partition.PartitionDescriptor;
import io.b2mash.governance.partition.PartitionPolicy;

/**
 * @param policy policy owning the partitioned table
 * @param partition partition to export
 * @param bucket target bucket; null selects the storage default
 * @param prefix key prefix, leading and trailing slashes are ignored
 * @param visibility object visibility passed to storage
 * @param runId rotation run id, recorded in object metadata
 */
public record ArchiveRequest(
    PartitionPolicy policy,
    PartitionDescriptor partition,
    String bucket,
    String prefix,
    String visibility,
    String runId) {}
