package com.flamingo.ai.policyanalysis.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.policyanalysis.exception.ModelConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("LangChain4jConfig Tests")
class LangChain4jConfigTest {

  private LangChain4jConfig config;

  @BeforeEach
  void setUp() {
    config = new LangChain4jConfig(new AnalysisConfig());
    ReflectionTestUtils.setField(config, "maxCompletionTokens", 16384);
    ReflectionTestUtils.setField(config, "timeout", Duration.ofSeconds(180));
  }

  @Test
  @DisplayName("should reject startup with a configuration error when the API key is blank")
  void shouldThrowConfigurationError_whenApiKeyBlank() {
    ReflectionTestUtils.setField(config, "openAiApiKey", " ");

    assertThatThrownBy(config::chatModel)
        .isInstanceOf(ModelConfigurationException.class)
        .hasMessageContaining("OPENAI_API_KEY")
        .extracting(e -> ((ModelConfigurationException) e).getModelId())
        .isEqualTo(new AnalysisConfig().getModel().getDefaultModel());
  }

  @Test
  @DisplayName("should build the chat model when an API key is set")
  void shouldBuildChatModel_whenApiKeyPresent() {
    ReflectionTestUtils.setField(config, "openAiApiKey", "sk-test");

    assertThat(config.chatModel()).isNotNull();
  }
}
