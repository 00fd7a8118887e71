package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import java.util.List;

/**
 * Result of a chunked analysis.
 *
 * @param analysis the merged analysis
 * @param contributingIndices indices of the chunks that were merged, ascending
 * @param dropped chunks that were left out, ascending by index
 * @param summarySynthesized whether the summary was rewritten by a synthesis call
 */
public record ChunkedAnalysis(
    StructuredAnalysis analysis,
    List<Integer> contributingIndices,
    List<DroppedChunk> dropped,
    boolean summarySynthesized) {

  public ChunkedAnalysis {
    contributingIndices = List.copyOf(contributingIndices);
    dropped = List.copyOf(dropped);
  }

  public boolean isPartial() {
    return !dropped.isEmpty();
  }
}
