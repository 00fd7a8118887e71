package com.flamingo.ai.policyanalysis.service.analysis.cache;

/**
 * SHA-256 identity of (content, content kind, model, schema version), as lowercase hex. Equal
 * fingerprints mean the analysis would be the same request.
 *
 * @param value 64 hex characters
 */
public record Fingerprint(String value) {

  public Fingerprint {
    if (value == null || value.length() != 64) {
      throw new IllegalArgumentException("Fingerprint must be a SHA-256 hex digest");
    }
  }

  /** First 12 characters, for log lines. */
  public String shortValue() {
    return value.substring(0, 12);
  }

  @Override
  public String toString() {
    return value;
  }
}
