package com.flamingo.ai.notevault.config;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors backing the embedding job queue. */
@Configuration
public class AsyncConfig {

  /**
   * Runs individual embedding attempts. Sized to the queue's concurrency limit; admission is
   * bounded by the queue itself, so the work queue here never grows past that limit.
   */
  @Bean(name = "embeddingJobExecutor")
  public Executor embeddingJobExecutor(VaultConfig vaultConfig) {
    int maxConcurrent = vaultConfig.getQueue().getMaxConcurrent();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxConcurrent);
    executor.setMaxPoolSize(maxConcurrent);
    executor.setThreadNamePrefix("embed-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }

  /** Fires retry attempts after their backoff delay without parking a job thread. */
  @Bean(name = "embeddingRetryScheduler", destroyMethod = "shutdownNow")
  public ScheduledExecutorService embeddingRetryScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new CustomizableThreadFactory("embed-retry-"));
  }
}
