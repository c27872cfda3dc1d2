package io.b2mash.governance.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared infrastructure for the governance jobs: the scheduler that drives retention and
 * partition cycles, the executor that runs archive uploads alongside row serialization, the
 * clock, and the JSON mapper.
 */
@Configuration
public class GovernanceConfig {

  @Bean
  Clock governanceClock() {
    return Clock.systemUTC();
  }

  @Bean
  JsonMapper governanceJsonMapper() {
    return JsonMapper.builder().build();
  }

  @Bean
  TaskScheduler governanceTaskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("governance-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  ThreadPoolTaskExecutor archiveUploadExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("archive-upload-");
    executor.initialize();
    return executor;
  }
}
