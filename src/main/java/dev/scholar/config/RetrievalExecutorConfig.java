package dev.scholar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the bounded thread pool on which one search runs its retrieval strategies
 * concurrently.
 */
@Configuration
public class RetrievalExecutorConfig {

  /**
   * Creates the retrieval executor.
   *
   * @param poolSize core and maximum number of threads
   * @return executor qualified as {@code "retrievalExecutor"}
   */
  @Bean(name = "retrievalExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor retrievalExecutor(
      @Value("${scholar.retrieval.pool-size:8}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(poolSize * 16);
    executor.setThreadNamePrefix("retrieval-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
