package com.flamingo.ai.hybridrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the executor running external pipeline stages. */
@Configuration
public class AsyncConfig {

  /**
   * Executor for dense/sparse fan-out and time-bounded LLM calls. Rejected submissions surface as
   * stage failures and take that stage's fallback.
   */
  @Bean(name = "retrievalExecutor")
  public AsyncTaskExecutor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(64);
    executor.setThreadNamePrefix("retrieval-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
