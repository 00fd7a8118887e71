package com.flamingo.ai.policyanalysis.exception;

import java.util.List;

/** Exception thrown when a model response does not conform to the analysis schema. */
public class SchemaValidationException extends AnalysisException {

  private final List<String> violations;

  public SchemaValidationException(List<String> violations) {
    super("Response failed schema validation: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }

  @Override
  public String getErrorType() {
    return "schema_invalid";
  }
}
