package io.b2mash.governance.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetentionStrategyRegistryTest {

  private final RetentionStrategy strategy =
      policy -> RetentionPlan.of(RetentionSelection.from("unit_records"), "test");

  @Test
  void register_blankName_throws() {
    var registry = new RetentionStrategyRegistry();

    assertThatThrownBy(() -> registry.register(" ", strategy))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("non-empty entityName");
    assertThatThrownBy(() -> registry.register(null, strategy))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void register_nullStrategy_throws() {
    var registry = new RetentionStrategyRegistry();

    assertThatThrownBy(() -> registry.register("unit_records", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unit_records");
  }

  @Test
  void get_unknownEntity_returnsNull() {
    var registry = new RetentionStrategyRegistry();

    assertThat(registry.get("missing")).isNull();
    assertThat(registry.get(null)).isNull();
  }

  @Test
  void register_thenUnregister_removesStrategy() {
    var registry = new RetentionStrategyRegistry();
    registry.register("unit_records", strategy);

    assertThat(registry.get("unit_records")).isSameAs(strategy);

    registry.unregister("unit_records");

    assertThat(registry.get("unit_records")).isNull();
    assertThat(registry.listRegistered()).isEmpty();
  }

  @Test
  void register_sameNameTwice_replacesStrategy() {
    var registry = new RetentionStrategyRegistry();
    RetentionStrategy replacement =
        policy -> RetentionPlan.of(RetentionSelection.from("other_records"), "replacement");

    registry.register("unit_records", strategy);
    registry.register("unit_records", replacement);

    assertThat(registry.get("unit_records")).isSameAs(replacement);
    assertThat(registry.listRegistered()).containsExactly("unit_records");
  }

  @Test
  void listRegistered_returnsSortedNames() {
    var registry = new RetentionStrategyRegistry();
    registry.register("zeta", strategy);
    registry.register("alpha", strategy);
    registry.register("mid", strategy);

    assertThat(registry.listRegistered()).containsExactly("alpha", "mid", "zeta");
  }
}
