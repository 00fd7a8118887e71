package com.flamingo.ai.policyanalysis.exception;

import java.util.Map;

/** Exception thrown when no chunk of a chunked analysis produced a usable result. */
public class AllChunksFailedException extends AnalysisException {

  private final Map<Integer, Throwable> failures;

  public AllChunksFailedException(String documentId, Map<Integer, Throwable> failures) {
    super("All " + failures.size() + " chunks failed for document " + documentId);
    this.failures = Map.copyOf(failures);
    failures.values().forEach(this::addSuppressed);
  }

  /** Failure cause per chunk index. */
  public Map<Integer, Throwable> getFailures() {
    return failures;
  }

  @Override
  public String getErrorType() {
    return "all_chunks_failed";
  }
}
