package com.flamingo.ai.policyanalysis.service.analysis;

import com.flamingo.ai.policyanalysis.domain.enums.AnalysisRoute;
import com.flamingo.ai.policyanalysis.service.analysis.cache.Fingerprint;
import com.flamingo.ai.policyanalysis.service.analysis.orchestration.DroppedChunk;
import java.util.List;

/**
 * How an analysis was produced.
 *
 * @param fingerprint identity of the request
 * @param route path taken through the pipeline
 * @param modelId model that produced the analysis
 * @param processingTimeMs wall-clock time of the computation
 * @param tokenCount tokens in the preprocessed text; 0 for PDFs
 * @param chunkCount chunks the text was split into; 1 for a direct call, 0 when no call was made
 * @param contributingChunks chunk indices merged into the result
 * @param droppedChunks chunks left out of the result
 * @param pageCount pages of a PDF, or {@code null} for text
 * @param cacheHit whether this caller was served a result computed by an earlier request
 */
public record AnalysisProvenance(
    Fingerprint fingerprint,
    AnalysisRoute route,
    String modelId,
    long processingTimeMs,
    int tokenCount,
    int chunkCount,
    List<Integer> contributingChunks,
    List<DroppedChunk> droppedChunks,
    Integer pageCount,
    boolean cacheHit) {

  public AnalysisProvenance {
    contributingChunks = contributingChunks == null ? List.of() : List.copyOf(contributingChunks);
    droppedChunks = droppedChunks == null ? List.of() : List.copyOf(droppedChunks);
  }

  public AnalysisProvenance asCacheHit() {
    return new AnalysisProvenance(
        fingerprint,
        route,
        modelId,
        processingTimeMs,
        tokenCount,
        chunkCount,
        contributingChunks,
        droppedChunks,
        pageCount,
        true);
  }
}
