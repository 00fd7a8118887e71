package com.flamingo.ai.policyanalysis.service.analysis.cache;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisOutcome;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single-flight cache of analysis outcomes keyed by {@link Fingerprint}.
 *
 * <p>Backed by a Caffeine {@link AsyncCache}: concurrent callers for the same fingerprint share one
 * future, so the computation runs once. A failed future is dropped by Caffeine and the next
 * request recomputes. Outcomes with partial coverage are handed to every waiter and then removed
 * unless {@code analysis.cache.cache-partial-results} is set. In-flight entries are never evicted.
 */
@Component
@Slf4j
public class AnalysisCache {

  public static final String CACHE_NAME = "analysis-outcomes";

  private final AsyncCache<Fingerprint, AnalysisOutcome> cache;
  private final boolean cachePartialResults;

  public AnalysisCache(AnalysisConfig analysisConfig, MeterRegistry meterRegistry) {
    AnalysisConfig.Cache config = analysisConfig.getCache();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(config.getMaximumSize())
            .expireAfterWrite(config.getTtl())
            .recordStats()
            .buildAsync();
    this.cachePartialResults = config.isCachePartialResults();
    CaffeineCacheMetrics.monitor(meterRegistry, cache.synchronous(), CACHE_NAME);
  }

  /**
   * Returns the outcome for {@code fingerprint}, running {@code compute} only if no entry exists
   * and no computation is in flight.
   *
   * @param fingerprint the request identity
   * @param compute starts the computation; invoked at most once among concurrent callers
   * @return a future completing with the shared outcome or failure
   */
  public CompletableFuture<AnalysisOutcome> getOrCompute(
      Fingerprint fingerprint, Supplier<CompletableFuture<AnalysisOutcome>> compute) {
    CompletableFuture<AnalysisOutcome> shared = lookup(fingerprint, compute);
    if (shared.isCompletedExceptionally()) {
      // A failure Caffeine has not removed yet must not be served to a new request
      cache.asMap().remove(fingerprint, shared);
      shared = lookup(fingerprint, compute);
    }
    CompletableFuture<AnalysisOutcome> entry = shared;
    // Each caller gets a dependent view so cancelling one cannot complete the shared entry
    return entry.thenApply(
        outcome -> {
          if (!cachePartialResults
              && outcome != null
              && outcome.isPartial()
              && cache.asMap().remove(fingerprint, entry)) {
            log.debug("Removed partial outcome {} from cache", fingerprint.shortValue());
          }
          return outcome;
        });
  }

  public boolean contains(Fingerprint fingerprint) {
    CompletableFuture<AnalysisOutcome> entry = cache.getIfPresent(fingerprint);
    return entry != null && !entry.isCompletedExceptionally();
  }

  public void invalidate(Fingerprint fingerprint) {
    cache.synchronous().invalidate(fingerprint);
  }

  public long size() {
    return cache.synchronous().estimatedSize();
  }

  /**
   * The mapping function only installs a future. {@code compute} runs on Caffeine's executor, so a
   * concurrent caller for the same key gets the pending future back instead of waiting on the
   * entry's lock while the first caller routes and tokenizes.
   */
  private CompletableFuture<AnalysisOutcome> lookup(
      Fingerprint fingerprint, Supplier<CompletableFuture<AnalysisOutcome>> compute) {
    return cache.get(
        fingerprint,
        (key, executor) ->
            CompletableFuture.completedFuture(key)
                .thenComposeAsync(ignored -> start(compute), executor));
  }

  private CompletableFuture<AnalysisOutcome> start(
      Supplier<CompletableFuture<AnalysisOutcome>> compute) {
    try {
      return compute.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
