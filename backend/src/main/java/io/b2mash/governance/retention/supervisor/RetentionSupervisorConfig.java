package io.b2mash.governance.retention.supervisor;

import io.b2mash.governance.retention.RetentionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class RetentionSupervisorConfig {

  @Bean
  CycleLock retentionCycleLock(
      RetentionProperties properties,
      JdbcClient jdbcClient,
      PlatformTransactionManager transactionManager) {
    return properties.singleWriterLock()
        ? new PostgresAdvisoryCycleLock(jdbcClient, transactionManager)
        : CycleLock.unguarded();
  }
}
