package io.b2mash.governance.partition;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for partition rotation and archiving.
 *
 * @param maxExportRows abort an export past this many rows; null for no limit
 * @param maxExportBytes abort an export past this many uncompressed bytes; null for no limit
 * @param archive archive destination defaults
 */
@ConfigurationProperties(prefix = "governance.partitioning")
public record PartitionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("0 30 2 * * *") String cron,
    @DefaultValue("Etc/UTC") String timezone,
    @DefaultValue("false") boolean dryRun,
    @DefaultValue("false") boolean runOnStartup,
    @DefaultValue("6") int lookaheadMonths,
    @DefaultValue("1") int lookbehindMonths,
    @DefaultValue("3") int minActivePartitions,
    @DefaultValue("45") int archiveGraceDays,
    @DefaultValue("5000") int exportBatchSize,
    Long maxExportRows,
    Long maxExportBytes,
    @DefaultValue Archive archive) {

  /**
   * @param bucket archive bucket; null falls back to {@code aws.s3.bucket-name}
   * @param prefix key prefix
   * @param visibility "public" or "workspace"
   * @param compress gzip the NDJSON stream
   */
  public record Archive(
      String bucket,
      @DefaultValue("archives/compliance") String prefix,
      @DefaultValue("workspace") String visibility,
      @DefaultValue("false") boolean compress) {}
}
