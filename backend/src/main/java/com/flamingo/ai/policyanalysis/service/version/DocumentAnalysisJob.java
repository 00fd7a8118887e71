package com.flamingo.ai.policyanalysis.service.version;

import com.flamingo.ai.policyanalysis.service.analysis.AnalysisRequest;

/**
 * One document in a batch.
 *
 * @param request what to analyse
 * @param expectedPredecessorId version the caller believes is current, or {@code null}
 */
public record DocumentAnalysisJob(AnalysisRequest request, Long expectedPredecessorId) {

  public static DocumentAnalysisJob of(AnalysisRequest request) {
    return new DocumentAnalysisJob(request, null);
  }

  public String documentId() {
    return request.metadata().documentId();
  }
}
