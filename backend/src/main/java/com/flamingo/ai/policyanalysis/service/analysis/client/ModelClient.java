package com.flamingo.ai.policyanalysis.service.analysis.client;

import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBundle;
import java.util.concurrent.CompletableFuture;

/**
 * The only component that talks to the structured-generation service.
 *
 * <p>Implementations retry transient failures internally. Returned futures fail with:
 *
 * <ul>
 *   <li>{@link com.flamingo.ai.policyanalysis.exception.ModelConfigurationException} when the
 *       model cannot serve the content kind; no call is made
 *   <li>{@link com.flamingo.ai.policyanalysis.exception.SchemaValidationException} when responses
 *       kept violating the schema
 *   <li>{@link com.flamingo.ai.policyanalysis.exception.ModelCallFailedException} when retries were
 *       exhausted on any other failure
 * </ul>
 */
public interface ModelClient {

  /**
   * Requests one structured analysis.
   *
   * @param prompt prompts and schema; for text content the text is already in the user prompt
   * @param content decides the content kind, and supplies the attachment for PDFs
   * @param modelId model to call
   * @param chunkIndex index of the chunk being analysed, or {@code null} for a whole document
   * @return the parsed, schema-valid analysis without pipeline metadata
   */
  CompletableFuture<StructuredAnalysis> analyze(
      PromptBundle prompt, AnalysisContent content, String modelId, Integer chunkIndex);

  default CompletableFuture<StructuredAnalysis> analyze(
      PromptBundle prompt, AnalysisContent content, String modelId) {
    return analyze(prompt, content, modelId, null);
  }

  /**
   * Requests plain text, e.g. a synthesized summary.
   *
   * @param prompt a prompt without schema
   * @param modelId model to call
   * @return the model's text, stripped
   */
  CompletableFuture<String> synthesize(PromptBundle prompt, String modelId);
}
