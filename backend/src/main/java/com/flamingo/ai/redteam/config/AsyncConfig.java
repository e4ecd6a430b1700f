package com.flamingo.ai.redteam.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the document parsing pool. */
@Configuration
public class AsyncConfig {

  /**
   * Pool that parses the documents of an analysis batch.
   *
   * @param config supplies the thread count and queue capacity
   * @return the parsing executor
   */
  @Bean(name = "documentParsingExecutor")
  public Executor documentParsingExecutor(RedTeamConfig config) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.getAnalysis().getParserThreads());
    executor.setMaxPoolSize(config.getAnalysis().getParserThreads());
    executor.setQueueCapacity(config.getAnalysis().getQueueCapacity());
    executor.setThreadNamePrefix("uslm-parse-");
    // Overflow parses run on the submitting thread instead of failing the batch
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
