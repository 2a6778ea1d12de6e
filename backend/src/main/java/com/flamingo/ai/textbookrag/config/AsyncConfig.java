package com.flamingo.ai.textbookrag.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used at query time. */
@Configuration
public class AsyncConfig {

  /** Runs the vector and keyword searches of a hybrid query side by side. */
  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }
}
