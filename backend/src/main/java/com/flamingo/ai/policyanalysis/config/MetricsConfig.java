package com.flamingo.ai.policyanalysis.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  static final String ANALYSIS_PREFIX = "analysis.";

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Publishes p50, p95 and p99 for every analysis timer. */
  @Bean
  public MeterFilter analysisTimerPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getType() == Meter.Type.TIMER && id.getName().startsWith(ANALYSIS_PREFIX)) {
          return DistributionStatisticConfig.builder()
              .percentiles(0.5, 0.95, 0.99)
              .build()
              .merge(config);
        }
        return config;
      }
    };
  }
}
