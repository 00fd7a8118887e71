package com.flamingo.ai.policyanalysis.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    meterRegistry.config().meterFilter(new MetricsConfig().analysisTimerPercentiles());
  }

  @Test
  @DisplayName("should publish percentiles for analysis timers")
  void shouldPublishPercentiles_whenTimerIsAnalysisTimer() {
    Timer timer = meterRegistry.timer("analysis.model.call", "outcome", "success");
    timer.record(Duration.ofMillis(250));

    assertThat(timer.takeSnapshot().percentileValues()).hasSize(3);
  }

  @Test
  @DisplayName("should leave other timers alone")
  void shouldNotPublishPercentiles_whenTimerIsUnrelated() {
    Timer timer = meterRegistry.timer("jvm.gc.pause");
    timer.record(Duration.ofMillis(5));

    assertThat(timer.takeSnapshot().percentileValues()).isEmpty();
  }
}
