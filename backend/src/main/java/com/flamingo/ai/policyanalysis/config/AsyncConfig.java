package com.flamingo.ai.policyanalysis.config;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the threads that run model calls and schedule their retries. */
@Configuration
public class AsyncConfig {

  /** Runs blocking provider calls; sized from {@code analysis.concurrency}. */
  @Bean(name = "modelCallExecutor")
  public Executor modelCallExecutor(AnalysisConfig analysisConfig) {
    AnalysisConfig.Concurrency concurrency = analysisConfig.getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency.getExecutorCorePoolSize());
    executor.setMaxPoolSize(concurrency.getExecutorMaxPoolSize());
    executor.setQueueCapacity(concurrency.getExecutorQueueCapacity());
    executor.setThreadNamePrefix("model-call-");
    executor.initialize();
    return executor;
  }

  /** Schedules retry backoff delays so that no thread sleeps between attempts. */
  @Bean(name = "modelRetryScheduler", destroyMethod = "shutdown")
  public ScheduledExecutorService modelRetryScheduler() {
    return Executors.newScheduledThreadPool(2, new CustomizableThreadFactory("model-retry-"));
  }
}
