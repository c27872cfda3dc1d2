package io.b2mash.governance.retention.supervisor;

import java.util.Optional;
import java.util.function.Supplier;

/** Guards a cycle so that at most one process runs it at a time. */
public interface CycleLock {

  /**
   * Runs {@code work} while holding the named lock.
   *
   * @return the work's result, or empty when another holder has the lock
   */
  <T> Optional<T> runExclusively(String lockName, Supplier<T> work);

  /** A lock that never contends; used when single-writer locking is switched off. */
  static CycleLock unguarded() {
    return new CycleLock() {
      @Override
      public <T> Optional<T> runExclusively(String lockName, Supplier<T> work) {
        return Optional.ofNullable(work.get());
      }
    };
  }
}
