package com.flamingo.ai.policyanalysis.config;

import com.flamingo.ai.policyanalysis.service.analysis.client.ModelCallPolicies;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j instances shared by every model call. They are registered in the registries that
 * resilience4j-spring-boot3 auto-configures, so their metrics and health show up in actuator.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

  public static final String MODEL_CALL = "modelCall";

  @Bean
  public Retry modelCallRetry(
      RetryRegistry retryRegistry, AnalysisConfig analysisConfig, MeterRegistry meterRegistry) {
    Retry retry =
        retryRegistry.retry(MODEL_CALL, ModelCallPolicies.retryConfig(analysisConfig.getRetry()));
    Counter retries =
        Counter.builder("analysis.model.retry")
            .description("Model call attempts that were retried")
            .register(meterRegistry);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              retries.increment();
              log.warn(
                  "Retrying model call (attempt {}) in {} ms: {}",
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() == null
                      ? "unknown"
                      : event.getLastThrowable().getMessage());
            });
    return retry;
  }

  /** Process-wide limiter across all requests and chunks. */
  @Bean
  public Bulkhead modelCallBulkhead(
      BulkheadRegistry bulkheadRegistry, AnalysisConfig analysisConfig) {
    AnalysisConfig.Concurrency concurrency = analysisConfig.getConcurrency();
    return bulkheadRegistry.bulkhead(
        MODEL_CALL,
        BulkheadConfig.custom()
            .maxConcurrentCalls(concurrency.getMaxConcurrentCalls())
            .maxWaitDuration(concurrency.getMaxWaitDuration())
            .build());
  }
}
