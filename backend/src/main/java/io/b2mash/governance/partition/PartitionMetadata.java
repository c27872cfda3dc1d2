package io.b2mash.governance.partition;

import java.util.Map;

/**
 * Per-policy overrides parsed from the policy's metadata JSON. Null fields fall back to the
 * {@code governance.partitioning} configuration.
 */
public record PartitionMetadata(
    String archiveBucket,
    String archivePrefix,
    String archiveVisibility,
    boolean manualApprovalRequired,
    Integer minActivePartitions,
    boolean skipDrop,
    Integer archiveGraceDays) {

  public static PartitionMetadata from(Map<String, Object> raw) {
    Map<String, Object> source = raw != null ? raw : Map.of();
    return new PartitionMetadata(
        stringOf(source.get("archiveBucket")),
        stringOf(source.get("archivePrefix")),
        stringOf(source.get("archiveVisibility")),
        Boolean.TRUE.equals(source.get("manualApprovalRequired")),
        integerOf(source.get("minActivePartitions")),
        Boolean.TRUE.equals(source.get("skipDrop")),
        integerOf(source.get("archiveGraceDays")));
  }

  private static String stringOf(Object value) {
    return value != null && !value.toString().isBlank() ? value.toString() : null;
  }

  private static Integer integerOf(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && text.matches("\\s*-?\\d+\\s*")) {
      return Integer.parseInt(text.trim());
    }
    return null;
  }
}
