package com.flamingo.ai.policyanalysis.exception;

import java.time.Duration;

/** Exception thrown when a request runs past its deadline with no usable result. */
public class AnalysisDeadlineExceededException extends AnalysisException {

  private final Duration deadline;

  public AnalysisDeadlineExceededException(String documentId, Duration deadline) {
    super("Analysis of document " + documentId + " exceeded deadline of " + deadline);
    this.deadline = deadline;
  }

  public Duration getDeadline() {
    return deadline;
  }

  @Override
  public String getErrorType() {
    return "deadline_exceeded";
  }
}
