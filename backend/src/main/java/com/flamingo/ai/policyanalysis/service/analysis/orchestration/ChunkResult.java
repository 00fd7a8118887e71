package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;

/**
 * A successful analysis of one chunk, as input to {@link AnalysisMerger}.
 *
 * @param index the chunk index
 * @param tokenCount tokens in the chunk; weights its confidence in the merge
 * @param analysis the chunk's analysis
 */
public record ChunkResult(int index, int tokenCount, StructuredAnalysis analysis) {}
