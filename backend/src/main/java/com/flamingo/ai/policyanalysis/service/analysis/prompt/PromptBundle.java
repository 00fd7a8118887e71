package com.flamingo.ai.policyanalysis.service.analysis.prompt;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Everything a model call needs besides the content attachment.
 *
 * @param systemPrompt instructions sent as the system message
 * @param userPrompt the user message text
 * @param schema structured-output schema, or {@code null} for a plain-text call
 * @param schemaVersion version of {@code schema}, or {@code null} for a plain-text call
 */
public record PromptBundle(
    String systemPrompt, String userPrompt, JsonSchema schema, String schemaVersion) {

  public boolean isStructured() {
    return schema != null;
  }
}
