package com.flamingo.ai.knowledge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for retrieval, reindexing and bounded backend calls.
 *
 * <p>Scheduling is enabled for the vector store reconnection probe.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /** Runs every embedding, vector store and relational call under a time limit. */
  @Bean(name = "backendCallExecutor")
  public ThreadPoolTaskExecutor backendCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(32);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("backend-call-");
    executor.initialize();
    return executor;
  }

  /** Runs searches submitted asynchronously. */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }

  /** Shared by all rebuilds; per-rebuild concurrency is capped separately. */
  @Bean(name = "reindexExecutor")
  public ThreadPoolTaskExecutor reindexExecutor(RetrievalConfig retrievalConfig) {
    int concurrency = Math.max(1, retrievalConfig.getReindex().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency * 2);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("reindex-");
    executor.initialize();
    return executor;
  }
}
