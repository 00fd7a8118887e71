package com.flamingo.ai.policyanalysis.service.analysis.prompt;

/**
 * Where a chunk sits in its document.
 *
 * @param index 0-based chunk index
 * @param total number of chunks in the document
 * @param structured whether the document was split along legislative sections
 */
public record ChunkPosition(int index, int total, boolean structured) {

  public ChunkPosition {
    if (total < 1 || index < 0 || index >= total) {
      throw new IllegalArgumentException(
          "Invalid chunk position " + index + " of " + total);
    }
  }

  public boolean isFirst() {
    return index == 0;
  }

  public boolean isLast() {
    return index == total - 1;
  }
}
