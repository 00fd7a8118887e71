package com.flamingo.ai.policyanalysis.service.analysis.chunking;

/**
 * Splits long text into ordered segments that each fit a token budget.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks: it does
 * not preprocess, prompt or call models.
 */
public interface TextChunker {

  /**
   * Splits {@code text} into gapless, non-overlapping chunks.
   *
   * @param text the document text
   * @param maxTokensPerChunk token budget per chunk; must be positive
   * @param modelId model whose tokenizer measures the chunks
   * @return the chunks in document order
   */
  ChunkingResult split(String text, int maxTokensPerChunk, String modelId);
}
