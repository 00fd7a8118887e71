package com.flamingo.ai.policyanalysis.exception;

/**
 * Thrown when the requested model cannot serve the request as configured, e.g. a PDF sent to a
 * model without vision support. Never retried.
 */
public class ModelConfigurationException extends AnalysisException {

  private final String modelId;

  public ModelConfigurationException(String modelId, String message) {
    super(message);
    this.modelId = modelId;
  }

  public String getModelId() {
    return modelId;
  }

  @Override
  public String getErrorType() {
    return "configuration";
  }
}
