package com.flamingo.ai.policyanalysis.service.version;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;

/**
 * Result of {@link VersionedAnalysisService#analyzeBatch}.
 *
 * @param succeeded ids of documents whose analysis was recorded
 * @param failed error type per document that could not be analysed or recorded
 * @param partialCoverage ids of recorded documents whose analysis dropped some chunks
 */
@Builder
public record BatchAnalysisReport(
    @Singular("succeeded") List<String> succeeded,
    @Singular("failed") Map<String, String> failed,
    @Singular("partialCoverage") List<String> partialCoverage) {

  public int total() {
    return succeeded.size() + failed.size();
  }
}
