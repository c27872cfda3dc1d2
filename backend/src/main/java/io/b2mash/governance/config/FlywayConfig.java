package io.b2mash.governance.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the engine's own migrations. The engine usually shares a database with the application
 * whose tables it governs, so it keeps a separate history table and baselines against a
 * non-empty schema.
 */
@Configuration
public class FlywayConfig {

  static final String HISTORY_TABLE = "governance_schema_history";

  @Bean(initMethod = "migrate")
  public Flyway governanceFlyway(DataSource dataSource) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration")
        .table(HISTORY_TABLE)
        .baselineOnMigrate(true)
        .baselineVersion("0")
        .load();
  }
}
