package com.flamingo.ai.policyanalysis.exception;

/** Exception thrown when content cannot be prepared for analysis (splitting, PDF inspection). */
public class ContentProcessingException extends AnalysisException {

  private final String documentId;

  public ContentProcessingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public ContentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }

  @Override
  public String getErrorType() {
    return "content_processing";
  }
}
