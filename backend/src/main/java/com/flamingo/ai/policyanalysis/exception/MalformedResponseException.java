package com.flamingo.ai.policyanalysis.exception;

/** The model answered, but the body was empty or not a JSON object. */
public class MalformedResponseException extends TransientCallException {

  public MalformedResponseException(String message) {
    super(message);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getErrorType() {
    return "malformed_response";
  }
}
