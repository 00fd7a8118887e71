package com.flamingo.ai.policyanalysis.exception;

/** Base class for every failure raised by the analysis pipeline. */
public abstract class AnalysisException extends RuntimeException {

  protected AnalysisException(String message) {
    super(message);
  }

  protected AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short, stable identifier used for metric tags and batch reports. */
  public abstract String getErrorType();
}
