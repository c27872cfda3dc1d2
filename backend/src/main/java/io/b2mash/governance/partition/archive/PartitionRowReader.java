package io.b2mash.governance.partition.archive;

import io.b2mash.governance.partition.PartitionDescriptor;
import io.b2mash.governance.partition.PartitionPolicy;
import java.util.Map;
import java.util.function.Consumer;

/** Streams the rows of one partition range. */
public interface PartitionRowReader {

  /**
   * Passes every row with {@code start <= dateColumn < end} to {@code consumer}, ordered by the
   * date column. An exception thrown by the consumer stops the stream and propagates.
   */
  void streamRows(
      PartitionPolicy policy,
      PartitionDescriptor partition,
      Consumer<Map<String, Object>> consumer);
}
