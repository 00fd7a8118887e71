package com.flamingo.ai.policyanalysis.service.analysis.chunking;

import java.util.List;

/**
 * Output of {@link TextChunker#split}.
 *
 * @param chunks ordered chunks; their texts concatenate to the input exactly
 * @param structured whether the document showed legislative section structure, which the chunk
 *     prompts tell the model about
 */
public record ChunkingResult(List<TextChunk> chunks, boolean structured) {

  public ChunkingResult {
    chunks = List.copyOf(chunks);
  }

  public int size() {
    return chunks.size();
  }

  public long hardSplitCount() {
    return chunks.stream().filter(TextChunk::hardSplit).count();
  }

  public int totalTokens() {
    return chunks.stream().mapToInt(TextChunk::tokenCount).sum();
  }
}
