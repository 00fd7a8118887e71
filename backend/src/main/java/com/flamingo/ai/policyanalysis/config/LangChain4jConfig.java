package com.flamingo.ai.policyanalysis.config;

import com.flamingo.ai.policyanalysis.exception.ModelConfigurationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j chat model that produces analyses. */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final AnalysisConfig analysisConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:16384}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:PT180S}")
  private Duration timeout;

  /**
   * Chat model used for every analysis call. Per-request model names override the default, and
   * retries are left to the pipeline's own policy.
   */
  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(analysisConfig.getModel().getDefaultModel())
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(timeout)
        .maxRetries(0)
        .supportedCapabilities(Capability.RESPONSE_FORMAT_JSON_SCHEMA)
        .strictJsonSchema(true)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new ModelConfigurationException(
          analysisConfig.getModel().getDefaultModel(),
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
