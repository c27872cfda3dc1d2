package io.b2mash.governance.partition;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One contiguous range segment of a partitioned table, {@code [start, end)}.
 *
 * @param name label such as {@code p202401}; monthly partitions are physically named {@code
 *     <table>_<label>}
 * @param start inclusive lower bound
 * @param end exclusive upper bound
 */
public record PartitionDescriptor(String name, LocalDate start, LocalDate end) {

  private static final Pattern MONTHLY_LABEL = Pattern.compile("^p(\\d{4})(\\d{2})$");

  public static PartitionDescriptor monthly(YearMonth month) {
    return new PartitionDescriptor(
        "p%04d%02d".formatted(month.getYear(), month.getMonthValue()),
        month.atDay(1),
        month.plusMonths(1).atDay(1));
  }

  /** Decodes a {@code pYYYYMM} label into its monthly bounds. */
  public static Optional<PartitionDescriptor> decode(String label) {
    if (label == null) {
      return Optional.empty();
    }
    var matcher = MONTHLY_LABEL.matcher(label);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    int month = Integer.parseInt(matcher.group(2));
    if (month < 1 || month > 12) {
      return Optional.empty();
    }
    return Optional.of(monthly(YearMonth.of(Integer.parseInt(matcher.group(1)), month)));
  }

  public static boolean isMonthlyLabel(String label) {
    return label != null && MONTHLY_LABEL.matcher(label).matches();
  }
}
