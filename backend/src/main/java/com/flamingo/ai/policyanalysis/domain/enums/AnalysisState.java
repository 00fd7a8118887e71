package com.flamingo.ai.policyanalysis.domain.enums;

/** States an analysis request moves through. */
public enum AnalysisState {
  RECEIVED,
  FINGERPRINTED,
  CACHE_CHECK,
  CACHE_HIT,
  INSUFFICIENT_TEXT,
  DIRECT_CALL,
  CHUNKED_CALL,
  DONE,
  FAILED
}
