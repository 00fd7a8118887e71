package com.flamingo.ai.policyanalysis.service.analysis.token;

/**
 * Counts tokens for a text under a named model's tokenization scheme.
 *
 * <p>Implementations must be deterministic for a given (text, model) pair and safe for concurrent
 * use.
 */
@FunctionalInterface
public interface TokenCounter {

  /**
   * Counts the tokens in {@code text}.
   *
   * @param text the text to measure; {@code null} counts as empty
   * @param modelId the model whose tokenizer applies; unknown models fall back to a default
   * @return the token count, never negative
   */
  int count(String text, String modelId);
}
