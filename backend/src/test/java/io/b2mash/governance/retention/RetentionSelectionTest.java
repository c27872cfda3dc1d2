package io.b2mash.governance.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetentionSelectionTest {

  @Test
  void fromClause_withoutPredicates_rendersTableOnly() {
    var selection = RetentionSelection.from("unit_records");

    assertThat(selection.fromClause()).isEqualTo("FROM \"unit_records\"");
    assertThat(selection.whereClause()).isEmpty();
  }

  @Test
  void fromClause_joinsPredicatesWithAnd() {
    var selection =
        RetentionSelection.from("unit_records")
            .where("created_at < :cutoff", "cutoff", 30)
            .where("deleted_at IS NULL");

    assertThat(selection.fromClause())
        .isEqualTo("FROM \"unit_records\" WHERE (created_at < :cutoff) AND (deleted_at IS NULL)");
    assertThat(selection.params()).containsEntry("cutoff", 30);
  }

  @Test
  void where_returnsNewInstance_leavingOriginalUntouched() {
    var base = RetentionSelection.from("unit_records").where("a = 1");

    var narrowed = base.where("b = 2");

    assertThat(base.predicates()).containsExactly("a = 1");
    assertThat(narrowed.predicates()).containsExactly("a = 1", "b = 2");
  }

  @Test
  void where_sameParameterTwice_throws() {
    var selection = RetentionSelection.from("unit_records").where("a = :days", "days", 1);

    assertThatThrownBy(() -> selection.where("b = :days", "days", 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("days");
  }

  @Test
  void where_blankPredicate_throws() {
    var selection = RetentionSelection.from("unit_records");

    assertThatThrownBy(() -> selection.where(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void from_invalidTableName_throws() {
    assertThatThrownBy(() -> RetentionSelection.from("records; DROP TABLE users"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
