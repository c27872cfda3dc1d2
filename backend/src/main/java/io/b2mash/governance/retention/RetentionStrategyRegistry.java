package io.b2mash.governance.retention;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps entity names to {@link RetentionStrategy} instances. Strategies can be registered and
 * removed at runtime; a policy whose entity has no strategy is reported as unsupported rather
 * than failed.
 */
public class RetentionStrategyRegistry {

  private static final Logger log = LoggerFactory.getLogger(RetentionStrategyRegistry.class);

  private final Map<String, RetentionStrategy> strategies = new ConcurrentHashMap<>();

  /**
   * Registers (or replaces) the strategy for an entity.
   *
   * @throws IllegalArgumentException if the name is blank or the strategy is null
   */
  public void register(String entityName, RetentionStrategy strategy) {
    if (entityName == null || entityName.isBlank()) {
      throw new IllegalArgumentException("Retention strategies require a non-empty entityName");
    }
    if (strategy == null) {
      throw new IllegalArgumentException(
          "Retention strategy for \"" + entityName + "\" must not be null");
    }
    var previous = strategies.put(entityName, strategy);
    if (previous != null) {
      log.info("Replaced retention strategy for entity {}", entityName);
    }
  }

  public void unregister(String entityName) {
    if (entityName != null) {
      strategies.remove(entityName);
    }
  }

  /** Returns the strategy for the entity, or null when none is registered. */
  public RetentionStrategy get(String entityName) {
    return entityName != null ? strategies.get(entityName) : null;
  }

  public List<String> listRegistered() {
    return strategies.keySet().stream().sorted().toList();
  }
}
