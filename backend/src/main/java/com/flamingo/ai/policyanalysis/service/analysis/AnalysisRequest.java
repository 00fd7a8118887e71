package com.flamingo.ai.policyanalysis.service.analysis;

import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import com.flamingo.ai.policyanalysis.service.analysis.model.DocumentMetadata;
import java.time.Duration;

/**
 * A request to analyse one document.
 *
 * @param content text or PDF bytes
 * @param metadata the bill
 * @param modelId model to use, or {@code null} for {@code analysis.model.default-model}
 * @param deadline time allowed, or {@code null} for {@code analysis.pipeline.deadline}
 */
public record AnalysisRequest(
    AnalysisContent content, DocumentMetadata metadata, String modelId, Duration deadline) {

  public AnalysisRequest {
    if (content == null || metadata == null) {
      throw new IllegalArgumentException("content and metadata are required");
    }
    if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
      throw new IllegalArgumentException("deadline must be positive");
    }
  }

  public static AnalysisRequest of(AnalysisContent content, DocumentMetadata metadata) {
    return new AnalysisRequest(content, metadata, null, null);
  }

  public AnalysisRequest withModel(String model) {
    return new AnalysisRequest(content, metadata, model, deadline);
  }

  public AnalysisRequest withDeadline(Duration newDeadline) {
    return new AnalysisRequest(content, metadata, modelId, newDeadline);
  }
}
