package io.b2mash.governance.partition;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PartitionDescriptorTest {

  @Test
  void monthly_decemberRollsIntoNextYear() {
    var descriptor = PartitionDescriptor.monthly(YearMonth.of(2024, 12));

    assertThat(descriptor.name()).isEqualTo("p202412");
    assertThat(descriptor.start()).isEqualTo(LocalDate.of(2024, 12, 1));
    assertThat(descriptor.end()).isEqualTo(LocalDate.of(2025, 1, 1));
  }

  @Test
  void decode_validLabel_returnsMonthlyBounds() {
    assertThat(PartitionDescriptor.decode("p202402"))
        .contains(PartitionDescriptor.monthly(YearMonth.of(2024, 2)));
  }

  @Test
  void decode_invalidLabels_areEmpty() {
    assertThat(PartitionDescriptor.decode(null)).isEmpty();
    assertThat(PartitionDescriptor.decode("p202413")).isEmpty();
    assertThat(PartitionDescriptor.decode("p202400")).isEmpty();
    assertThat(PartitionDescriptor.decode("p2024")).isEmpty();
    assertThat(PartitionDescriptor.decode("default")).isEmpty();
  }

  @Test
  void isMonthlyLabel_matchesPattern() {
    assertThat(PartitionDescriptor.isMonthlyLabel("p203001")).isTrue();
    assertThat(PartitionDescriptor.isMonthlyLabel("audit_events_p203001")).isFalse();
    assertThat(PartitionDescriptor.isMonthlyLabel(null)).isFalse();
  }

  @Test
  void metadata_parsesOverridesAndIgnoresBadValues() {
    var metadata =
        PartitionMetadata.from(
            Map.of(
                "archiveBucket", "cold-storage",
                "archivePrefix", " ",
                "manualApprovalRequired", true,
                "minActivePartitions", "4",
                "skipDrop", "true",
                "archiveGraceDays", "soon"));

    assertThat(metadata.archiveBucket()).isEqualTo("cold-storage");
    assertThat(metadata.archivePrefix()).isNull();
    assertThat(metadata.manualApprovalRequired()).isTrue();
    assertThat(metadata.minActivePartitions()).isEqualTo(4);
    // only boolean true enables skipDrop
    assertThat(metadata.skipDrop()).isFalse();
    assertThat(metadata.archiveGraceDays()).isNull();
  }

  @Test
  void policy_nullMetadata_defaultsToEmptyOverrides() {
    var policy = new PartitionPolicy(1L, "audit_events", "occurred_at", "monthly_range", 30, null);

    assertThat(policy.isMonthlyRange()).isTrue();
    assertThat(policy.metadata().minActivePartitions()).isNull();
    assertThat(policy.metadata().skipDrop()).isFalse();
  }
}
