package com.flamingo.ai.policyanalysis.service.version;

import com.flamingo.ai.policyanalysis.domain.entity.AnalysisVersion;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisOutcome;
import java.util.List;
import java.util.Optional;

/** Append-only history of analyses per document. */
public interface AnalysisVersionStore {

  /**
   * Records {@code outcome} as the next version of {@code documentId}.
   *
   * @param documentId the document
   * @param outcome the pipeline outcome to record
   * @param expectedPredecessorId id of the version the caller believes is current, or {@code null}
   *     to append after whatever is current
   * @return the new version, or the current one when its fingerprint is unchanged and unchanged
   *     results are skipped
   * @throws com.flamingo.ai.policyanalysis.exception.StaleVersionException if {@code
   *     expectedPredecessorId} is not the current version
   */
  AnalysisVersion append(String documentId, AnalysisOutcome outcome, Long expectedPredecessorId);

  default AnalysisVersion append(String documentId, AnalysisOutcome outcome) {
    return append(documentId, outcome, null);
  }

  Optional<AnalysisVersion> findCurrent(String documentId);

  /** All versions of the document, newest first. */
  List<AnalysisVersion> findHistory(String documentId);
}
