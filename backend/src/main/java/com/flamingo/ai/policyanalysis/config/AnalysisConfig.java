package com.flamingo.ai.policyanalysis.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the analysis pipeline. */
@Configuration
@ConfigurationProperties(prefix = "analysis")
@Validated
@Getter
@Setter
public class AnalysisConfig {

  @Valid private Model model = new Model();
  @Valid private Pipeline pipeline = new Pipeline();
  @Valid private Chunking chunking = new Chunking();
  @Valid private Retry retry = new Retry();
  @Valid private Concurrency concurrency = new Concurrency();
  @Valid private Cache cache = new Cache();
  @Valid private Merge merge = new Merge();
  @Valid private Pdf pdf = new Pdf();
  @Valid private Versioning versioning = new Versioning();

  /**
   * Resolves the context window for a model, honouring per-model overrides.
   *
   * @param modelId the model identifier
   * @return the maximum number of tokens a single direct call may carry
   */
  public int contextWindowFor(String modelId) {
    if (modelId != null) {
      Integer override = pipeline.getContextWindows().get(modelId);
      if (override != null) {
        return override;
      }
    }
    return pipeline.getMaxContextTokens();
  }

  /**
   * Resolves the per-chunk token budget for a model. An explicit budget wins; otherwise the
   * context window minus the safety buffer is used.
   */
  public int chunkBudgetFor(String modelId) {
    if (chunking.getTokenBudget() > 0) {
      return chunking.getTokenBudget();
    }
    return Math.max(1, contextWindowFor(modelId) - pipeline.getSafetyBuffer());
  }

  @Getter
  @Setter
  public static class Model {
    /** Model used when a request does not name one. */
    @NotBlank(message = "A default model is required")
    private String defaultModel = "gpt-4o-2024-08-06";

    /** Whether the vision (PDF attachment) path may be used at all. */
    private boolean visionEnabled = true;

    /** Model name prefixes that accept PDF attachments. */
    private List<String> visionModelPrefixes =
        new ArrayList<>(List.of("gpt-4o", "gpt-4.1", "gpt-5", "o"));

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.2;
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** Below this many tokens the text is reported as insufficient for analysis. */
    private int minAnalyzableTokens = 300;

    @Min(1)
    private int maxContextTokens = 120_000;

    /** Tokens reserved for instructions and the response when deriving the chunk budget. */
    private int safetyBuffer = 20_000;

    /** Per-model context window overrides, keyed by model identifier. */
    private Map<String, Integer> contextWindows = new LinkedHashMap<>();

    /** Overall deadline applied to a request that does not carry its own. */
    @NotNull private Duration deadline = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Explicit per-chunk budget; 0 derives it from the context window and safety buffer. */
    @Min(0)
    private int tokenBudget = 0;

    /** Minimum heading matches before a document is treated as structured. */
    private int structureThreshold = 3;
  }

  @Getter
  @Setter
  public static class Retry {
    @Min(value = 1, message = "At least one attempt is required")
    private int maxAttempts = 4;

    @NotNull private Duration initialInterval = Duration.ofSeconds(1);

    @DecimalMin("1.0")
    private double multiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Concurrency {
    /** Process-wide cap on in-flight model calls. */
    @Min(1)
    private int maxConcurrentCalls = 5;

    /** How long a call may wait for a free slot before it counts as a transient failure. */
    private Duration maxWaitDuration = Duration.ofSeconds(30);

    private int executorCorePoolSize = 5;
    private int executorMaxPoolSize = 10;
    private int executorQueueCapacity = 500;
  }

  @Getter
  @Setter
  public static class Cache {
    private long maximumSize = 1000;
    private Duration ttl = Duration.ofMinutes(30);

    /**
     * Whether outcomes with dropped chunks stay cached. They stem from transient failures, so by
     * default the next request recomputes them.
     */
    private boolean cachePartialResults = false;
  }

  @Getter
  @Setter
  public static class Merge {
    /** Whether the concatenated chunk summaries are rewritten by one synthesis call. */
    private boolean synthesizeSummary = true;

    private int maxSummaryChars = 2000;
    private int maxKeyPoints = 15;
    private int maxFlatImpacts = 10;
    private int maxSectionItems = 8;
    private int maxRecommendedActions = 8;
    private int maxOtherActions = 5;
  }

  @Getter
  @Setter
  public static class Pdf {
    @Min(1)
    private int maxPages = 100;
    private long maxBytes = 32L * 1024 * 1024; // 32 MiB
  }

  @Getter
  @Setter
  public static class Versioning {
    /** Return the current version instead of appending when the fingerprint is unchanged. */
    private boolean skipUnchanged = true;
  }
}
