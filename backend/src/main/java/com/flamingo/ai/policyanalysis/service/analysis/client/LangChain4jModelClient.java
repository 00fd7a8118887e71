package com.flamingo.ai.policyanalysis.service.analysis.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.domain.enums.ContentKind;
import com.flamingo.ai.policyanalysis.exception.AnalysisException;
import com.flamingo.ai.policyanalysis.exception.MalformedResponseException;
import com.flamingo.ai.policyanalysis.exception.ModelCallFailedException;
import com.flamingo.ai.policyanalysis.exception.ModelConfigurationException;
import com.flamingo.ai.policyanalysis.exception.SchemaValidationException;
import com.flamingo.ai.policyanalysis.exception.TransientCallException;
import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBundle;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.PdfFileContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.data.pdf.PdfFile;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link ModelClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Each attempt runs on the {@code modelCallExecutor} inside the shared {@link Bulkhead}, and
 * failed attempts are retried by the shared {@link Retry} with delays scheduled on {@code
 * modelRetryScheduler}. Responses are parsed with Jackson and validated against the requested
 * schema before they are mapped to {@link StructuredAnalysis}. Cancelling a returned future stops
 * the call: no further attempt starts and the running one is interrupted.
 */
@Service
@Slf4j
public class LangChain4jModelClient implements ModelClient {

  private static final Pattern FENCED_JSON =
      Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final AnalysisSchemaValidator schemaValidator;
  private final Retry retry;
  private final Bulkhead bulkhead;
  private final Executor modelCallExecutor;
  private final ScheduledExecutorService retryScheduler;
  private final AnalysisConfig analysisConfig;
  private final MeterRegistry meterRegistry;

  public LangChain4jModelClient(
      ChatModel chatModel,
      ObjectMapper objectMapper,
      AnalysisSchemaValidator schemaValidator,
      Retry modelCallRetry,
      Bulkhead modelCallBulkhead,
      @Qualifier("modelCallExecutor") Executor modelCallExecutor,
      @Qualifier("modelRetryScheduler") ScheduledExecutorService retryScheduler,
      AnalysisConfig analysisConfig,
      MeterRegistry meterRegistry) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.schemaValidator = schemaValidator;
    this.retry = modelCallRetry;
    this.bulkhead = modelCallBulkhead;
    this.modelCallExecutor = modelCallExecutor;
    this.retryScheduler = retryScheduler;
    this.analysisConfig = analysisConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public CompletableFuture<StructuredAnalysis> analyze(
      PromptBundle prompt, AnalysisContent content, String modelId, Integer chunkIndex) {
    if (content.isPdf() && !supportsVision(modelId)) {
      recordCall(Timer.start(meterRegistry), "config", content.kind());
      return CompletableFuture.failedFuture(
          new ModelConfigurationException(
              modelId, "Model " + modelId + " does not accept PDF attachments"));
    }
    ChatRequest request = buildRequest(prompt, content, modelId);
    return execute(request, content.kind(), chunkIndex, response -> toAnalysis(response, prompt));
  }

  @Override
  public CompletableFuture<String> synthesize(PromptBundle prompt, String modelId) {
    ChatRequest request = buildRequest(prompt, AnalysisContent.ofText(""), modelId);
    return execute(request, ContentKind.TEXT, null, this::toText);
  }

  /** Whether {@code modelId} may receive PDF attachments under the current configuration. */
  public boolean supportsVision(String modelId) {
    AnalysisConfig.Model model = analysisConfig.getModel();
    if (!model.isVisionEnabled() || modelId == null) {
      return false;
    }
    String normalized = modelId.toLowerCase(Locale.ROOT);
    return model.getVisionModelPrefixes().stream()
        .anyMatch(prefix -> normalized.startsWith(prefix.toLowerCase(Locale.ROOT)));
  }

  // ---- call execution ----

  private <T> CompletableFuture<T> execute(
      ChatRequest request,
      ContentKind kind,
      Integer chunkIndex,
      Function<ChatResponse, T> mapper) {
    AtomicInteger attempts = new AtomicInteger();
    AtomicBoolean cancelled = new AtomicBoolean();
    AtomicReference<Future<?>> inFlight = new AtomicReference<>();
    Timer.Sample sample = Timer.start(meterRegistry);

    CompletableFuture<T> result =
        Retry.decorateCompletionStage(
                retry,
                retryScheduler,
                () -> {
                  if (cancelled.get()) {
                    return CompletableFuture.<T>failedFuture(
                        new CancellationException("Model call cancelled"));
                  }
                  attempts.incrementAndGet();
                  return submitAttempt(() -> mapper.apply(call(request)), cancelled, inFlight);
                })
            .get()
            .toCompletableFuture()
            .handle(
                (value, error) -> {
                  if (error == null) {
                    recordCall(sample, "success", kind);
                    return value;
                  }
                  Throwable cause = ModelCallPolicies.unwrap(error);
                  if (cancelled.get()) {
                    throw new CompletionException(cause);
                  }
                  recordCall(sample, outcomeOf(cause), kind);
                  throw new CompletionException(escalate(cause, chunkIndex, attempts.get()));
                });

    // Cancelling the returned future stops pending retries and interrupts the running attempt
    result.whenComplete(
        (value, error) -> {
          if (result.isCancelled() && cancelled.compareAndSet(false, true)) {
            Future<?> running = inFlight.get();
            if (running != null) {
              running.cancel(true);
            }
            recordCall(sample, "cancelled", kind);
            log.debug(
                "Model call{} cancelled after {} attempts",
                chunkIndex == null ? "" : " for chunk " + chunkIndex,
                attempts.get());
          }
        });
    return result;
  }

  /**
   * Runs one attempt on {@code modelCallExecutor} inside the bulkhead. The task is published
   * through {@code inFlight} so that cancellation can interrupt it, which also releases its
   * bulkhead permit.
   */
  private <T> CompletableFuture<T> submitAttempt(
      Supplier<T> attempt, AtomicBoolean cancelled, AtomicReference<Future<?>> inFlight) {
    CompletableFuture<T> future = new CompletableFuture<>();
    FutureTask<T> task =
        new FutureTask<T>(() -> bulkhead.executeSupplier(attempt)) {
          @Override
          protected void done() {
            if (isCancelled()) {
              future.completeExceptionally(new CancellationException("Model call cancelled"));
              return;
            }
            try {
              future.complete(get());
            } catch (ExecutionException e) {
              future.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              future.completeExceptionally(e);
            }
          }
        };
    inFlight.set(task);
    if (cancelled.get()) {
      task.cancel(true);
      return future;
    }
    try {
      modelCallExecutor.execute(task);
    } catch (RuntimeException e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  private ChatResponse call(ChatRequest request) {
    try {
      return chatModel.chat(request);
    } catch (RateLimitException e) {
      throw new TransientCallException("Rate limited by provider: " + e.getMessage(), true, e);
    } catch (RetriableException e) {
      throw new TransientCallException("Provider call failed: " + e.getMessage(), e);
    }
  }

  private RuntimeException escalate(Throwable cause, Integer chunkIndex, int attempts) {
    if (cause instanceof ModelConfigurationException
        || cause instanceof SchemaValidationException) {
      return (AnalysisException) cause;
    }
    String target = chunkIndex == null ? "Model call" : "Model call for chunk " + chunkIndex;
    log.error("{} failed after {} attempts: {}", target, attempts, cause.getMessage());
    return new ModelCallFailedException(
        target + " failed after " + attempts + " attempts: " + cause.getMessage(),
        chunkIndex,
        attempts,
        ModelCallPolicies.isRateLimited(cause),
        cause);
  }

  // ---- request / response mapping ----

  private ChatRequest buildRequest(PromptBundle prompt, AnalysisContent content, String modelId) {
    UserMessage userMessage =
        content.isPdf()
            ? UserMessage.from(
                TextContent.from(prompt.userPrompt()),
                PdfFileContent.from(
                    PdfFile.builder()
                        .base64Data(Base64.getEncoder().encodeToString(content.bytes()))
                        .mimeType("application/pdf")
                        .build()))
            : UserMessage.from(prompt.userPrompt());
    List<ChatMessage> messages = List.of(SystemMessage.from(prompt.systemPrompt()), userMessage);

    ChatRequest.Builder builder =
        ChatRequest.builder()
            .messages(messages)
            .modelName(modelId)
            .temperature(analysisConfig.getModel().getTemperature());
    if (prompt.isStructured()) {
      builder.responseFormat(
          ResponseFormat.builder()
              .type(ResponseFormatType.JSON)
              .jsonSchema(prompt.schema())
              .build());
    }
    return builder.build();
  }

  private StructuredAnalysis toAnalysis(ChatResponse response, PromptBundle prompt) {
    JsonNode node = extractJson(responseText(response));
    schemaValidator.requireValid(node, prompt.schema());
    try {
      return objectMapper.treeToValue(node, StructuredAnalysis.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new MalformedResponseException("Response could not be mapped: " + e.getMessage(), e);
    }
  }

  private String toText(ChatResponse response) {
    String text = responseText(response);
    if (text == null || text.isBlank()) {
      throw new MalformedResponseException("Empty response from model");
    }
    return text.strip();
  }

  private String responseText(ChatResponse response) {
    return response == null || response.aiMessage() == null ? null : response.aiMessage().text();
  }

  /**
   * Parses the response as JSON, falling back to a fenced {@code ```json} block and then to the
   * outermost braces when the model wrapped its answer in prose.
   */
  JsonNode extractJson(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedResponseException("Empty response from model");
    }
    JsonNode direct = tryParseObject(raw.strip());
    if (direct != null) {
      return direct;
    }

    Matcher fenced = FENCED_JSON.matcher(raw);
    if (fenced.find()) {
      JsonNode node = tryParseObject(fenced.group(1));
      if (node != null) {
        return node;
      }
    }

    int start = raw.indexOf('{');
    int end = raw.lastIndexOf('}');
    if (start >= 0 && end > start) {
      JsonNode node = tryParseObject(raw.substring(start, end + 1));
      if (node != null) {
        return node;
      }
    }
    throw new MalformedResponseException(
        "Response is not valid JSON: " + raw.substring(0, Math.min(raw.length(), 200)));
  }

  private JsonNode tryParseObject(String candidate) {
    try {
      JsonNode node = objectMapper.readTree(candidate);
      return node != null && node.isObject() ? node : null;
    } catch (JsonProcessingException e) {
      log.debug("Candidate is not JSON: {}", e.getOriginalMessage());
      return null;
    }
  }

  // ---- telemetry ----

  private String outcomeOf(Throwable cause) {
    if (cause instanceof ModelConfigurationException) {
      return "config";
    }
    if (cause instanceof SchemaValidationException) {
      return "schema";
    }
    return ModelCallPolicies.isTransient(cause) ? "transient" : "failed";
  }

  private void recordCall(Timer.Sample sample, String outcome, ContentKind kind) {
    sample.stop(
        Timer.builder("analysis.model.call")
            .tag("outcome", outcome)
            .tag("content_kind", kind.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry));
  }
}
