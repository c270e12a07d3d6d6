package com.scholary.codeindex.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up a bounded thread pool for indexing jobs, one task per active job, and a small
 * separate pool for notification delivery so a slow backend never holds an indexing thread.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "indexingExecutor")
  public Executor indexingExecutor(
      @Value("${indexing.executor.threads}") int threads,
      @Value("${indexing.executor.queue-size}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("indexing-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "notificationExecutor")
  public Executor notificationExecutor(@Value("${indexing.notifications.threads}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("notification-");
    executor.initialize();
    return executor;
  }
}
