package com.flamingo.ai.policyanalysis.service.version;

import com.flamingo.ai.policyanalysis.domain.entity.AnalysisVersion;
import com.flamingo.ai.policyanalysis.exception.AnalysisException;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisOutcome;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisPipeline;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisRequest;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelCallPolicies;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs the pipeline and records each result as a new version of its document. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VersionedAnalysisService {

  private final AnalysisPipeline analysisPipeline;
  private final AnalysisVersionStore versionStore;

  @Timed(value = "analysis.record", description = "Time to analyse and record a document")
  public AnalysisVersion analyzeAndRecord(String documentId, AnalysisRequest request) {
    return analyzeAndRecord(documentId, request, null);
  }

  /**
   * Analyses a document and appends the outcome to its history.
   *
   * @param documentId the document; must match the request's metadata
   * @param request what to analyse
   * @param expectedPredecessorId version the caller believes is current, or {@code null}
   * @return the recorded version, or the current one if nothing changed
   */
  public AnalysisVersion analyzeAndRecord(
      String documentId, AnalysisRequest request, Long expectedPredecessorId) {
    requireMatchingDocument(documentId, request);
    AnalysisOutcome outcome = analysisPipeline.analyzeAndWait(request);
    return versionStore.append(documentId, outcome, expectedPredecessorId);
  }

  /**
   * Analyses many documents concurrently and records each result. Model calls are bounded by the
   * process-wide bulkhead; versions are appended one by one on the calling thread.
   */
  @Timed(value = "analysis.batch", description = "Time to analyse and record a batch")
  public BatchAnalysisReport analyzeBatch(List<DocumentAnalysisJob> jobs) {
    log.info("Starting batch analysis of {} documents", jobs.size());
    List<CompletableFuture<AnalysisOutcome>> pending = new ArrayList<>(jobs.size());
    for (DocumentAnalysisJob job : jobs) {
      pending.add(analysisPipeline.analyze(job.request()));
    }

    BatchAnalysisReport.BatchAnalysisReportBuilder report = BatchAnalysisReport.builder();
    for (int i = 0; i < jobs.size(); i++) {
      DocumentAnalysisJob job = jobs.get(i);
      try {
        AnalysisOutcome outcome = pending.get(i).join();
        versionStore.append(job.documentId(), outcome, job.expectedPredecessorId());
        report.succeeded(job.documentId());
        if (outcome.isPartial()) {
          report.partialCoverage(job.documentId());
        }
      } catch (RuntimeException e) {
        Throwable cause = ModelCallPolicies.unwrap(e);
        String errorType =
            cause instanceof AnalysisException analysisError
                ? analysisError.getErrorType()
                : "unexpected";
        log.error(
            "Batch analysis failed for document {}: {}", job.documentId(), cause.getMessage());
        report.failed(job.documentId(), errorType);
      }
    }

    BatchAnalysisReport result = report.build();
    log.info(
        "Batch analysis finished: {} succeeded, {} failed, {} partial",
        result.succeeded().size(),
        result.failed().size(),
        result.partialCoverage().size());
    return result;
  }

  private void requireMatchingDocument(String documentId, AnalysisRequest request) {
    if (!request.metadata().documentId().equals(documentId)) {
      throw new IllegalArgumentException(
          "Request is for document "
              + request.metadata().documentId()
              + ", not "
              + documentId);
    }
  }
}
