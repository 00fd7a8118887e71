package com.flamingo.ai.policyanalysis.domain.enums;

/** Path a request took through the pipeline. */
public enum AnalysisRoute {
  INSUFFICIENT_TEXT,
  DIRECT,
  CHUNKED,
  VISION
}
