package com.flamingo.ai.policyanalysis.service.analysis.cache;

import static com.flamingo.ai.policyanalysis.service.analysis.AnalysisFixtures.fingerprint;
import static com.flamingo.ai.policyanalysis.service.analysis.AnalysisFixtures.outcome;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.exception.ModelCallFailedException;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AnalysisCache Tests")
class AnalysisCacheTest {

  private final Fingerprint key = fingerprint('a');

  private AnalysisConfig analysisConfig;
  private AnalysisCache cache;

  @BeforeEach
  void setUp() {
    analysisConfig = new AnalysisConfig();
    cache = new AnalysisCache(analysisConfig, new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("should compute once and share the result with concurrent callers")
  void shouldComputeOnce_whenCallersOverlap() {
    AtomicInteger computations = new AtomicInteger();
    CompletableFuture<AnalysisOutcome> inFlight = new CompletableFuture<>();

    CompletableFuture<AnalysisOutcome> first =
        cache.getOrCompute(
            key,
            () -> {
              computations.incrementAndGet();
              return inFlight;
            });
    CompletableFuture<AnalysisOutcome> second =
        cache.getOrCompute(
            key,
            () -> {
              computations.incrementAndGet();
              return CompletableFuture.completedFuture(outcome(key, "other", false));
            });

    assertThat(first).isNotDone();
    inFlight.complete(outcome(key, "Shared.", false));

    assertThat(first.join().analysis().summary()).isEqualTo("Shared.");
    assertThat(second.join()).isEqualTo(first.join());
    assertThat(computations).hasValue(1);
    assertThat(cache.contains(key)).isTrue();
  }

  @Test
  @DisplayName("should serve a completed entry without recomputing")
  void shouldReturnCached_whenEntryCompleted() {
    cache
        .getOrCompute(key, () -> CompletableFuture.completedFuture(outcome(key, "One.", false)))
        .join();

    AnalysisOutcome again =
        cache
            .getOrCompute(
                key,
                () -> {
                  throw new AssertionError("should not recompute");
                })
            .join();

    assertThat(again.analysis().summary()).isEqualTo("One.");
  }

  @Test
  @DisplayName("should not keep a failure, so the next request recomputes")
  void shouldRecompute_whenPreviousAttemptFailed() {
    CompletableFuture<AnalysisOutcome> failed =
        cache.getOrCompute(
            key,
            () ->
                CompletableFuture.failedFuture(
                    new ModelCallFailedException("down", null, 4, false, null)));

    assertThatThrownBy(failed::join).hasCauseInstanceOf(ModelCallFailedException.class);

    AnalysisOutcome retried =
        cache
            .getOrCompute(
                key, () -> CompletableFuture.completedFuture(outcome(key, "Recovered.", false)))
            .join();
    assertThat(retried.analysis().summary()).isEqualTo("Recovered.");
  }

  @Test
  @DisplayName("should turn an exception thrown while starting into a failed future")
  void shouldFailFuture_whenComputeThrows() {
    CompletableFuture<AnalysisOutcome> result =
        cache.getOrCompute(
            key,
            () -> {
              throw new IllegalStateException("boom");
            });

    assertThatThrownBy(result::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(cache.contains(key)).isFalse();
  }

  @Test
  @DisplayName("should hand a partial outcome to waiters but not keep it")
  void shouldEvictPartialOutcome_whenCachingPartialsDisabled() {
    CompletableFuture<AnalysisOutcome> inFlight = new CompletableFuture<>();
    CompletableFuture<AnalysisOutcome> first = cache.getOrCompute(key, () -> inFlight);
    CompletableFuture<AnalysisOutcome> second = cache.getOrCompute(key, () -> inFlight);

    inFlight.complete(outcome(key, "Partial.", true));

    assertThat(first.join().isPartial()).isTrue();
    assertThat(second.join().isPartial()).isTrue();
    assertThat(cache.contains(key)).isFalse();
  }

  @Test
  @DisplayName("should keep partial outcomes when configured to")
  void shouldKeepPartialOutcome_whenCachingPartialsEnabled() {
    analysisConfig.getCache().setCachePartialResults(true);
    cache = new AnalysisCache(analysisConfig, new SimpleMeterRegistry());

    cache
        .getOrCompute(key, () -> CompletableFuture.completedFuture(outcome(key, "P.", true)))
        .join();

    assertThat(cache.contains(key)).isTrue();
  }

  @Test
  @DisplayName("should not let one caller's cancellation affect the shared entry")
  void shouldIsolateCallers_whenOneCancels() {
    CompletableFuture<AnalysisOutcome> inFlight = new CompletableFuture<>();
    CompletableFuture<AnalysisOutcome> impatient = cache.getOrCompute(key, () -> inFlight);
    CompletableFuture<AnalysisOutcome> patient = cache.getOrCompute(key, () -> inFlight);

    impatient.cancel(true);
    inFlight.complete(outcome(key, "Done.", false));

    assertThat(patient.join().analysis().summary()).isEqualTo("Done.");
    assertThat(inFlight).isNotCancelled();
  }

  @Test
  @DisplayName("should drop an entry on invalidate")
  void shouldRemoveEntry_whenInvalidated() {
    cache
        .getOrCompute(key, () -> CompletableFuture.completedFuture(outcome(key, "x", false)))
        .join();

    cache.invalidate(key);

    assertThat(cache.contains(key)).isFalse();
    assertThat(cache.size()).isZero();
  }
}
