package com.flamingo.ai.policyanalysis.exception;

/** Exception thrown when a model call fails in a way that may succeed on retry. */
public class TransientCallException extends AnalysisException {

  private final boolean rateLimited;

  public TransientCallException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
  }

  public TransientCallException(String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public TransientCallException(String message) {
    super(message);
    this.rateLimited = false;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  @Override
  public String getErrorType() {
    return rateLimited ? "rate_limited" : "transient";
  }
}
