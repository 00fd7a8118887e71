package com.flamingo.ai.policyanalysis.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.policyanalysis.exception.TransientCallException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResilienceConfig Tests")
class ResilienceConfigTest {

  private final ResilienceConfig resilienceConfig = new ResilienceConfig();
  private AnalysisConfig analysisConfig;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    analysisConfig = new AnalysisConfig();
    analysisConfig.getRetry().setInitialInterval(Duration.ofMillis(1));
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  @DisplayName("should count every retried attempt")
  void shouldCountRetries_whenCallRecovers() {
    Retry retry =
        resilienceConfig.modelCallRetry(RetryRegistry.ofDefaults(), analysisConfig, meterRegistry);
    AtomicInteger calls = new AtomicInteger();

    String result =
        retry.executeSupplier(
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new TransientCallException("timeout");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(meterRegistry.get("analysis.model.retry").counter().count()).isEqualTo(2.0);
    assertThat(retry.getName()).isEqualTo(ResilienceConfig.MODEL_CALL);
  }

  @Test
  @DisplayName("should size the bulkhead from the concurrency settings")
  void shouldSizeBulkhead_whenConfigured() {
    analysisConfig.getConcurrency().setMaxConcurrentCalls(3);

    Bulkhead bulkhead =
        resilienceConfig.modelCallBulkhead(BulkheadRegistry.ofDefaults(), analysisConfig);

    assertThat(bulkhead.getBulkheadConfig().getMaxConcurrentCalls()).isEqualTo(3);
    assertThat(bulkhead.getMetrics().getAvailableConcurrentCalls()).isEqualTo(3);
  }
}
