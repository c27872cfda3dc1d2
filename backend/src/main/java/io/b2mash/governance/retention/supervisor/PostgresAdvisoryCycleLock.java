package io.b2mash.governance.retention.supervisor;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link CycleLock} backed by a transaction-scoped PostgreSQL advisory lock. The lock is taken in
 * an outer transaction that stays open for the duration of the work and is released when it ends.
 */
public class PostgresAdvisoryCycleLock implements CycleLock {

  private static final Logger log = LoggerFactory.getLogger(PostgresAdvisoryCycleLock.class);

  private final JdbcClient jdbc;
  private final TransactionTemplate lockTransaction;

  public PostgresAdvisoryCycleLock(JdbcClient jdbc, PlatformTransactionManager transactionManager) {
    this.jdbc = jdbc;
    this.lockTransaction = new TransactionTemplate(transactionManager);
  }

  @Override
  public <T> Optional<T> runExclusively(String lockName, Supplier<T> work) {
    return lockTransaction.execute(
        status -> {
          Boolean acquired =
              jdbc.sql("SELECT pg_try_advisory_xact_lock(hashtext(:name))")
                  .param("name", lockName)
                  .query(Boolean.class)
                  .single();
          if (!Boolean.TRUE.equals(acquired)) {
            log.warn("Advisory lock {} is held by another process", lockName);
            return Optional.empty();
          }
          return Optional.ofNullable(work.get());
        });
  }
}
