package com.flamingo.ai.policyanalysis.service.analysis.token;

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TokenCounter} backed by LangChain4j's {@link OpenAiTokenCountEstimator} (jtokkit
 * encodings).
 *
 * <p>Estimators are resolved once per model id. A model the tokenizer does not know falls back to
 * {@value #FALLBACK_MODEL}; the fallback is logged once and counted under {@code
 * analysis.tokenizer.fallback} so a mis-measured model never goes unnoticed.
 */
@Service
@Slf4j
public class OpenAiTokenCounter implements TokenCounter {

  static final String FALLBACK_MODEL = "gpt-4o";

  private final MeterRegistry meterRegistry;
  private final Map<String, OpenAiTokenCountEstimator> estimators = new ConcurrentHashMap<>();

  public OpenAiTokenCounter(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public int count(String text, String modelId) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    String key = modelId == null || modelId.isBlank() ? FALLBACK_MODEL : modelId;
    return estimators.computeIfAbsent(key, this::resolve).estimateTokenCountInText(text);
  }

  private OpenAiTokenCountEstimator resolve(String modelId) {
    try {
      OpenAiTokenCountEstimator estimator = new OpenAiTokenCountEstimator(modelId);
      // Some unknown names only fail on first use
      estimator.estimateTokenCountInText("sample");
      return estimator;
    } catch (RuntimeException e) {
      log.warn(
          "No tokenizer for model '{}', counting with {} encoding instead: {}",
          modelId,
          FALLBACK_MODEL,
          e.getMessage());
      meterRegistry.counter("analysis.tokenizer.fallback", "model", modelId).increment();
      return new OpenAiTokenCountEstimator(FALLBACK_MODEL);
    }
  }
}
