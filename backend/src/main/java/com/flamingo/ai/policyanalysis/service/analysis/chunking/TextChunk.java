package com.flamingo.ai.policyanalysis.service.analysis.chunking;

/**
 * A contiguous, non-overlapping segment of a document's text.
 *
 * @param index sequential position within the document (0-based, gapless)
 * @param text the exact characters {@code [startOffset, endOffset)} of the source text
 * @param startOffset inclusive character offset into the source text
 * @param endOffset exclusive character offset into the source text
 * @param tokenCount tokens in {@code text} under the chunking model's tokenizer
 * @param hardSplit {@code true} when the segment was cut inside a sentence because the sentence
 *     alone exceeded the budget
 */
public record TextChunk(
    int index, String text, int startOffset, int endOffset, int tokenCount, boolean hardSplit) {}
