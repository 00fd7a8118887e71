package com.flamingo.ai.policyanalysis.domain.enums;

/** Form in which document content reaches the pipeline. */
public enum ContentKind {
  /** Extracted plain text (possibly HTML). */
  TEXT,

  /** Raw PDF bytes, analysed through the vision path. */
  PDF
}
