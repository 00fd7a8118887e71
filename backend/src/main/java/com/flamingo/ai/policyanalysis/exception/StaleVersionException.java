package com.flamingo.ai.policyanalysis.exception;

/** Exception thrown when a version append names a predecessor that is no longer current. */
public class StaleVersionException extends AnalysisException {

  private final String documentId;
  private final Long expectedPredecessorId;
  private final Long currentHeadId;

  public StaleVersionException(
      String documentId, Long expectedPredecessorId, Long currentHeadId) {
    super(
        "Document "
            + documentId
            + " expected predecessor "
            + expectedPredecessorId
            + " but current version is "
            + currentHeadId);
    this.documentId = documentId;
    this.expectedPredecessorId = expectedPredecessorId;
    this.currentHeadId = currentHeadId;
  }

  public String getDocumentId() {
    return documentId;
  }

  public Long getExpectedPredecessorId() {
    return expectedPredecessorId;
  }

  public Long getCurrentHeadId() {
    return currentHeadId;
  }

  @Override
  public String getErrorType() {
    return "stale_version";
  }
}
