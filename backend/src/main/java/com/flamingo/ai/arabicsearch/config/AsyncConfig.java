package com.flamingo.ai.arabicsearch.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background indexing runs. */
@Configuration
public class AsyncConfig {

  public static final String INDEXING_EXECUTOR = "indexingExecutor";

  /** Single worker: runs are serialized by the job service, the queue stays empty. */
  @Bean(name = INDEXING_EXECUTOR)
  public Executor indexingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.setThreadNamePrefix("indexing-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
