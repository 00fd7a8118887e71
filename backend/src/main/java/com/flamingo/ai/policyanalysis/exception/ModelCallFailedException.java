package com.flamingo.ai.policyanalysis.exception;

/**
 * Exception thrown when a model call keeps failing after every retry. Carries the chunk index when
 * the call analysed one chunk of a larger document.
 */
public class ModelCallFailedException extends AnalysisException {

  private final Integer chunkIndex;
  private final int attempts;
  private final boolean rateLimited;

  public ModelCallFailedException(
      String message, Integer chunkIndex, int attempts, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.chunkIndex = chunkIndex;
    this.attempts = attempts;
    this.rateLimited = rateLimited;
  }

  /** Index of the failed chunk, or {@code null} for a direct call. */
  public Integer getChunkIndex() {
    return chunkIndex;
  }

  public int getAttempts() {
    return attempts;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  @Override
  public String getErrorType() {
    return chunkIndex == null ? "direct_call_failed" : "chunk_failed";
  }
}
