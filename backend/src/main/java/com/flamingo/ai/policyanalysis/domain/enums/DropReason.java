package com.flamingo.ai.policyanalysis.domain.enums;

/** Why a chunk did not contribute to a merged analysis. */
public enum DropReason {
  /** Retries were exhausted on transient errors. */
  CALL_FAILED,

  /** The response never satisfied the analysis schema. */
  SCHEMA_INVALID,

  /** The request deadline passed while the call was still in flight. */
  DEADLINE_EXCEEDED
}
