package io.b2mash.governance.retention;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionConfig {

  @Bean
  RetentionStrategyRegistry retentionStrategyRegistry() {
    var registry = new RetentionStrategyRegistry();
    DefaultRetentionStrategies.registerAll(registry);
    return registry;
  }
}
