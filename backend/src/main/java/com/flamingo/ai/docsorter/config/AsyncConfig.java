package com.flamingo.ai.docsorter.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the bounded pool that runs batch language-model calls. */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class AsyncConfig {

  private final AnalysisConfig analysisConfig;

  @Bean(name = "analysisExecutor")
  public Executor analysisExecutor() {
    int poolSize = Math.max(1, analysisConfig.getBatch().getExecutorPoolSize());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ai-batch-");
    // A saturated pool runs the extraction on the submitting request thread.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
