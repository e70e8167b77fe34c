package io.b2mash.revel.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Worker pools for background dispatch and delayed delivery retries. */
@Configuration
public class AsyncConfig {

  public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";
  public static final String RETRY_SCHEDULER = "deliveryRetryScheduler";

  @Bean(name = NOTIFICATION_EXECUTOR)
  ThreadPoolTaskExecutor notificationExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(1_000);
    executor.setThreadNamePrefix("notify-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean(name = RETRY_SCHEDULER)
  ThreadPoolTaskScheduler deliveryRetryScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("notify-retry-");
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
