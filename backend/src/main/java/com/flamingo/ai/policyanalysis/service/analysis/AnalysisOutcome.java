package com.flamingo.ai.policyanalysis.service.analysis;

import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import java.util.Optional;

/**
 * What the pipeline returns for a request.
 *
 * @param analysis the normalized analysis
 * @param provenance how it was produced
 * @param partialCoverage set when some chunks were dropped, otherwise {@code null}
 */
public record AnalysisOutcome(
    StructuredAnalysis analysis,
    AnalysisProvenance provenance,
    PartialCoverageWarning partialCoverage) {

  public Optional<PartialCoverageWarning> partialCoverageWarning() {
    return Optional.ofNullable(partialCoverage);
  }

  public boolean isPartial() {
    return partialCoverage != null;
  }

  public AnalysisOutcome asCacheHit() {
    return new AnalysisOutcome(analysis, provenance.asCacheHit(), partialCoverage);
  }
}
