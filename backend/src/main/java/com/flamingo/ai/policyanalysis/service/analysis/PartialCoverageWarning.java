package com.flamingo.ai.policyanalysis.service.analysis;

import com.flamingo.ai.policyanalysis.service.analysis.orchestration.DroppedChunk;
import java.util.List;

/**
 * Returned alongside an analysis that covers only part of the document because some chunks were
 * dropped. Not an error.
 *
 * @param totalChunks chunks the document was split into
 * @param droppedChunks the chunks left out, ascending by index
 */
public record PartialCoverageWarning(int totalChunks, List<DroppedChunk> droppedChunks) {

  public PartialCoverageWarning {
    droppedChunks = List.copyOf(droppedChunks);
  }

  public List<Integer> droppedIndices() {
    return droppedChunks.stream().map(DroppedChunk::index).toList();
  }

  /** Share of chunks that made it into the analysis, between 0 and 1. */
  public double coverage() {
    return totalChunks == 0 ? 0.0 : (double) (totalChunks - droppedChunks.size()) / totalChunks;
  }

  public String message() {
    return String.format(
        "Analysis covers %d of %d chunks; dropped %s",
        totalChunks - droppedChunks.size(), totalChunks, droppedIndices());
  }
}
