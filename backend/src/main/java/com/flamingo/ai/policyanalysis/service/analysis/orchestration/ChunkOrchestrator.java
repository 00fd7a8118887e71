package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.domain.enums.DropReason;
import com.flamingo.ai.policyanalysis.exception.AllChunksFailedException;
import com.flamingo.ai.policyanalysis.exception.AnalysisDeadlineExceededException;
import com.flamingo.ai.policyanalysis.exception.AnalysisException;
import com.flamingo.ai.policyanalysis.exception.SchemaValidationException;
import com.flamingo.ai.policyanalysis.service.analysis.chunking.TextChunk;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelCallPolicies;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelClient;
import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import com.flamingo.ai.policyanalysis.service.analysis.model.DocumentMetadata;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.ChunkPosition;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Analyses a chunked document: one concurrent model call per chunk, then a merge of whatever
 * succeeded.
 *
 * <p>Calls are dispatched in chunk order. Concurrency is bounded by the model client's shared
 * bulkhead, and each call retries on its own. When the deadline passes, calls still in flight are
 * cancelled and the merge proceeds with the chunks that finished. Dropped chunks are reported on
 * the result rather than failing the request, unless nothing succeeded at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkOrchestrator {

  private final ModelClient modelClient;
  private final PromptBuilder promptBuilder;
  private final AnalysisMerger analysisMerger;
  private final AnalysisConfig analysisConfig;

  /**
   * Analyses {@code chunks} and merges the results.
   *
   * @param chunks the document's chunks in index order
   * @param metadata the bill, repeated in every chunk prompt
   * @param structured whether the chunks follow the bill's own sections
   * @param modelId model to call
   * @param deadline time allowed for all chunk calls and the summary synthesis
   * @return the merged analysis; fails with {@link AllChunksFailedException} when every chunk was
   *     dropped
   */
  public CompletableFuture<ChunkedAnalysis> analyzeChunked(
      List<TextChunk> chunks,
      DocumentMetadata metadata,
      boolean structured,
      String modelId,
      Duration deadline) {
    if (chunks.isEmpty()) {
      return CompletableFuture.failedFuture(
          new IllegalArgumentException("No chunks to analyse for " + metadata.documentId()));
    }
    long startNanos = System.nanoTime();
    int total = chunks.size();
    log.info(
        "Dispatching {} chunk calls for document {} (model {}, deadline {})",
        total,
        metadata.documentId(),
        modelId,
        deadline);

    List<CompletableFuture<StructuredAnalysis>> calls = new ArrayList<>(total);
    for (TextChunk chunk : chunks) {
      ChunkPosition position = new ChunkPosition(chunk.index(), total, structured);
      calls.add(
          modelClient.analyze(
              promptBuilder.forChunk(chunk.text(), metadata, position),
              AnalysisContent.ofText(chunk.text()),
              modelId,
              chunk.index()));
    }

    CompletableFuture<?>[] settled =
        calls.stream()
            .map(call -> call.handle((result, error) -> null))
            .toArray(CompletableFuture[]::new);

    return CompletableFuture.allOf(settled)
        .completeOnTimeout(null, deadline.toMillis(), TimeUnit.MILLISECONDS)
        .thenCompose(ignored -> collect(chunks, calls, metadata, modelId, deadline, startNanos));
  }

  private CompletableFuture<ChunkedAnalysis> collect(
      List<TextChunk> chunks,
      List<CompletableFuture<StructuredAnalysis>> calls,
      DocumentMetadata metadata,
      String modelId,
      Duration deadline,
      long startNanos) {
    List<ChunkResult> succeeded = new ArrayList<>();
    List<DroppedChunk> dropped = new ArrayList<>();
    Map<Integer, Throwable> failures = new LinkedHashMap<>();

    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      CompletableFuture<StructuredAnalysis> call = calls.get(i);

      if (!call.isDone()) {
        call.cancel(true);
        AnalysisDeadlineExceededException timeout =
            new AnalysisDeadlineExceededException(metadata.documentId(), deadline);
        failures.put(chunk.index(), timeout);
        dropped.add(
            new DroppedChunk(
                chunk.index(),
                DropReason.DEADLINE_EXCEEDED,
                timeout.getErrorType(),
                "Still running at the deadline"));
      } else if (call.isCompletedExceptionally()) {
        Throwable cause = ModelCallPolicies.unwrap(failureOf(call));
        failures.put(chunk.index(), cause);
        dropped.add(
            new DroppedChunk(
                chunk.index(),
                cause instanceof SchemaValidationException
                    ? DropReason.SCHEMA_INVALID
                    : DropReason.CALL_FAILED,
                cause instanceof AnalysisException analysisError
                    ? analysisError.getErrorType()
                    : cause.getClass().getSimpleName(),
                cause.getMessage()));
      } else {
        succeeded.add(new ChunkResult(chunk.index(), chunk.tokenCount(), call.getNow(null)));
      }
    }

    if (succeeded.isEmpty()) {
      log.error("All {} chunks failed for document {}", chunks.size(), metadata.documentId());
      return CompletableFuture.failedFuture(
          new AllChunksFailedException(metadata.documentId(), failures));
    }
    if (!dropped.isEmpty()) {
      log.warn(
          "Partial coverage for document {}: {} of {} chunks dropped {}",
          metadata.documentId(),
          dropped.size(),
          chunks.size(),
          dropped.stream().map(DroppedChunk::index).toList());
    }

    StructuredAnalysis merged = analysisMerger.merge(succeeded);
    List<Integer> contributing = succeeded.stream().map(ChunkResult::index).toList();
    List<String> summaries = analysisMerger.orderedSummaries(succeeded);
    Duration remaining = deadline.minusNanos(System.nanoTime() - startNanos);

    if (!analysisConfig.getMerge().isSynthesizeSummary()
        || summaries.size() < 2
        || remaining.isNegative()
        || remaining.isZero()) {
      return CompletableFuture.completedFuture(
          new ChunkedAnalysis(merged, contributing, dropped, false));
    }

    CompletableFuture<String> synthesis =
        modelClient.synthesize(promptBuilder.summarySynthesis(summaries, metadata), modelId);
    return synthesis
        .copy()
        .orTimeout(remaining.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (summary, error) -> {
              if (error != null) {
                synthesis.cancel(true);
                log.warn(
                    "Summary synthesis failed for document {}, keeping concatenated summary: {}",
                    metadata.documentId(),
                    ModelCallPolicies.unwrap(error).toString());
                return new ChunkedAnalysis(merged, contributing, dropped, false);
              }
              return new ChunkedAnalysis(merged.withSummary(summary), contributing, dropped, true);
            });
  }

  private Throwable failureOf(CompletableFuture<?> call) {
    return call.handle((result, error) -> error).getNow(null);
  }
}
