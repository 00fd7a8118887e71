package com.flamingo.ai.policyanalysis.service.analysis;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.domain.enums.AnalysisRoute;
import com.flamingo.ai.policyanalysis.domain.enums.AnalysisState;
import com.flamingo.ai.policyanalysis.exception.AnalysisDeadlineExceededException;
import com.flamingo.ai.policyanalysis.exception.AnalysisException;
import com.flamingo.ai.policyanalysis.service.analysis.cache.AnalysisCache;
import com.flamingo.ai.policyanalysis.service.analysis.cache.ContentFingerprinter;
import com.flamingo.ai.policyanalysis.service.analysis.cache.Fingerprint;
import com.flamingo.ai.policyanalysis.service.analysis.chunking.ChunkingResult;
import com.flamingo.ai.policyanalysis.service.analysis.chunking.TextChunker;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelCallPolicies;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelClient;
import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import com.flamingo.ai.policyanalysis.service.analysis.model.DocumentMetadata;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import com.flamingo.ai.policyanalysis.service.analysis.orchestration.ChunkOrchestrator;
import com.flamingo.ai.policyanalysis.service.analysis.preprocess.PdfContentInspector;
import com.flamingo.ai.policyanalysis.service.analysis.preprocess.PdfInfo;
import com.flamingo.ai.policyanalysis.service.analysis.preprocess.TextPreprocessor;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.AnalysisSchema;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBuilder;
import com.flamingo.ai.policyanalysis.service.analysis.token.TokenCounter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the analysis pipeline.
 *
 * <p>A request is fingerprinted and looked up in the {@link AnalysisCache}. On a miss the content
 * is routed:
 *
 * <ul>
 *   <li>PDF: one vision call with the file attached
 *   <li>text under {@code min-analyzable-tokens}: the canonical insufficient-text analysis, no call
 *   <li>text within the model's context window: one direct call
 *   <li>longer text: chunked, one call per chunk, merged
 * </ul>
 *
 * <p>The API is asynchronous; {@link #analyzeAndWait} is the blocking façade for callers that want
 * one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisPipeline {

  private final ContentFingerprinter fingerprinter;
  private final AnalysisCache analysisCache;
  private final TextPreprocessor textPreprocessor;
  private final TokenCounter tokenCounter;
  private final TextChunker textChunker;
  private final PdfContentInspector pdfContentInspector;
  private final PromptBuilder promptBuilder;
  private final ModelClient modelClient;
  private final ChunkOrchestrator chunkOrchestrator;
  private final AnalysisConfig analysisConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Analyses a document.
   *
   * @param request the document and options
   * @return the outcome; fails with an {@link AnalysisException} subtype
   */
  public CompletableFuture<AnalysisOutcome> analyze(AnalysisRequest request) {
    String documentId = request.metadata().documentId();
    String modelId = resolveModel(request);
    Duration deadline = resolveDeadline(request);
    transition(documentId, AnalysisState.RECEIVED);

    Fingerprint fingerprint =
        fingerprinter.fingerprint(request.content(), modelId, AnalysisSchema.SCHEMA_VERSION);
    transition(documentId, AnalysisState.FINGERPRINTED);

    AtomicBoolean computed = new AtomicBoolean();
    AtomicReference<AnalysisRoute> route = new AtomicReference<>();
    Timer.Sample sample = Timer.start(meterRegistry);
    transition(documentId, AnalysisState.CACHE_CHECK);

    return analysisCache
        .getOrCompute(
            fingerprint,
            () -> {
              computed.set(true);
              return compute(request, fingerprint, modelId, deadline, route);
            })
        .handle(
            (outcome, error) -> {
              boolean cacheHit = !computed.get();
              cacheCounter(cacheHit).increment();
              if (error != null) {
                Throwable cause = ModelCallPolicies.unwrap(error);
                recordRequest(sample, route.get(), "failed");
                transition(documentId, AnalysisState.FAILED);
                log.error("Analysis failed for document {}: {}", documentId, cause.getMessage());
                throw error instanceof CompletionException completion
                    ? completion
                    : new CompletionException(cause);
              }
              AnalysisOutcome result = outcome;
              if (cacheHit) {
                transition(documentId, AnalysisState.CACHE_HIT);
                result = outcome.asCacheHit();
              }
              transition(documentId, AnalysisState.DONE);
              recordRequest(
                  sample, result.provenance().route(), result.isPartial() ? "partial" : "success");
              return result;
            });
  }

  /**
   * Blocking façade over {@link #analyze}.
   *
   * @throws AnalysisException the typed failure, unwrapped from the future
   */
  public AnalysisOutcome analyzeAndWait(AnalysisRequest request) {
    try {
      return analyze(request).join();
    } catch (CompletionException | CancellationException e) {
      Throwable cause = ModelCallPolicies.unwrap(e);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }

  // ---- routing ----

  private CompletableFuture<AnalysisOutcome> compute(
      AnalysisRequest request,
      Fingerprint fingerprint,
      String modelId,
      Duration deadline,
      AtomicReference<AnalysisRoute> route) {
    long startNanos = System.nanoTime();
    DocumentMetadata metadata = request.metadata();
    String documentId = metadata.documentId();
    AnalysisContent content = request.content();

    if (content.isPdf()) {
      route.set(AnalysisRoute.VISION);
      PdfInfo pdf = pdfContentInspector.inspect(documentId, content.bytes());
      transition(documentId, AnalysisState.DIRECT_CALL);
      return withDeadline(
              modelClient.analyze(promptBuilder.forPdf(metadata), content, modelId),
              deadline,
              documentId)
          .thenApply(
              analysis ->
                  outcome(
                      analysis,
                      fingerprint,
                      AnalysisRoute.VISION,
                      modelId,
                      startNanos,
                      0,
                      1,
                      pdf.pageCount()));
    }

    String text = textPreprocessor.preprocess(content.text());
    int tokens = tokenCounter.count(text, modelId);
    log.debug("Document {} has {} tokens under {}", documentId, tokens, modelId);

    if (tokens < analysisConfig.getPipeline().getMinAnalyzableTokens()) {
      route.set(AnalysisRoute.INSUFFICIENT_TEXT);
      transition(documentId, AnalysisState.INSUFFICIENT_TEXT);
      log.info("Document {} has only {} tokens, skipping model call", documentId, tokens);
      StructuredAnalysis insufficient =
          StructuredAnalysis.insufficientText(modelId, elapsedMs(startNanos));
      return CompletableFuture.completedFuture(
          new AnalysisOutcome(
              insufficient,
              new AnalysisProvenance(
                  fingerprint,
                  AnalysisRoute.INSUFFICIENT_TEXT,
                  modelId,
                  insufficient.processingTimeMs(),
                  tokens,
                  0,
                  List.of(),
                  List.of(),
                  null,
                  false),
              null));
    }

    if (tokens <= analysisConfig.contextWindowFor(modelId)) {
      route.set(AnalysisRoute.DIRECT);
      return direct(text, metadata, fingerprint, modelId, deadline, startNanos, tokens);
    }

    int budget = analysisConfig.chunkBudgetFor(modelId);
    ChunkingResult chunking = textChunker.split(text, budget, modelId);
    if (chunking.size() == 1) {
      route.set(AnalysisRoute.DIRECT);
      log.info("Document {} fits one chunk of {} tokens, using a direct call", documentId, budget);
      return direct(
          chunking.chunks().get(0).text(),
          metadata,
          fingerprint,
          modelId,
          deadline,
          startNanos,
          tokens);
    }

    route.set(AnalysisRoute.CHUNKED);
    transition(documentId, AnalysisState.CHUNKED_CALL);
    return chunkOrchestrator
        .analyzeChunked(chunking.chunks(), metadata, chunking.structured(), modelId, deadline)
        .thenApply(
            chunked -> {
              StructuredAnalysis analysis =
                  chunked.analysis().withMetadata(modelId, elapsedMs(startNanos));
              PartialCoverageWarning warning =
                  chunked.isPartial()
                      ? new PartialCoverageWarning(chunking.size(), chunked.dropped())
                      : null;
              if (warning != null) {
                log.warn("Document {}: {}", documentId, warning.message());
              }
              return new AnalysisOutcome(
                  analysis,
                  new AnalysisProvenance(
                      fingerprint,
                      AnalysisRoute.CHUNKED,
                      modelId,
                      analysis.processingTimeMs(),
                      tokens,
                      chunking.size(),
                      chunked.contributingIndices(),
                      chunked.dropped(),
                      null,
                      false),
                  warning);
            });
  }

  private CompletableFuture<AnalysisOutcome> direct(
      String text,
      DocumentMetadata metadata,
      Fingerprint fingerprint,
      String modelId,
      Duration deadline,
      long startNanos,
      int tokens) {
    transition(metadata.documentId(), AnalysisState.DIRECT_CALL);
    return withDeadline(
            modelClient.analyze(
                promptBuilder.forDocument(text, metadata), AnalysisContent.ofText(text), modelId),
            deadline,
            metadata.documentId())
        .thenApply(
            analysis ->
                outcome(
                    analysis,
                    fingerprint,
                    AnalysisRoute.DIRECT,
                    modelId,
                    startNanos,
                    tokens,
                    1,
                    null));
  }

  private CompletableFuture<StructuredAnalysis> withDeadline(
      CompletableFuture<StructuredAnalysis> call, Duration deadline, String documentId) {
    return call.copy()
        .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (analysis, error) -> {
              if (error == null) {
                return analysis;
              }
              Throwable cause = ModelCallPolicies.unwrap(error);
              if (cause instanceof TimeoutException) {
                call.cancel(true);
                throw new CompletionException(
                    new AnalysisDeadlineExceededException(documentId, deadline));
              }
              throw new CompletionException(cause);
            });
  }

  private AnalysisOutcome outcome(
      StructuredAnalysis raw,
      Fingerprint fingerprint,
      AnalysisRoute route,
      String modelId,
      long startNanos,
      int tokens,
      int chunkCount,
      Integer pageCount) {
    StructuredAnalysis analysis = raw.withMetadata(modelId, elapsedMs(startNanos));
    return new AnalysisOutcome(
        analysis,
        new AnalysisProvenance(
            fingerprint,
            route,
            modelId,
            analysis.processingTimeMs(),
            tokens,
            chunkCount,
            List.of(0),
            List.of(),
            pageCount,
            false),
        null);
  }

  // ---- helpers ----

  private String resolveModel(AnalysisRequest request) {
    return request.modelId() == null || request.modelId().isBlank()
        ? analysisConfig.getModel().getDefaultModel()
        : request.modelId();
  }

  private Duration resolveDeadline(AnalysisRequest request) {
    return request.deadline() == null
        ? analysisConfig.getPipeline().getDeadline()
        : request.deadline();
  }

  private long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private void transition(String documentId, AnalysisState state) {
    log.debug("Document {} -> {}", documentId, state);
  }

  private Counter cacheCounter(boolean hit) {
    return Counter.builder("analysis.pipeline.cache")
        .tag("result", hit ? "hit" : "miss")
        .register(meterRegistry);
  }

  private void recordRequest(Timer.Sample sample, AnalysisRoute route, String outcome) {
    sample.stop(
        Timer.builder("analysis.pipeline.request")
            .tag("route", route == null ? "none" : route.name().toLowerCase(Locale.ROOT))
            .tag("outcome", outcome)
            .register(meterRegistry));
  }
}
