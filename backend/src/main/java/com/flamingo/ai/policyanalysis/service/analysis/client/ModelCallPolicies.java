package com.flamingo.ai.policyanalysis.service.analysis.client;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.exception.AnalysisException;
import com.flamingo.ai.policyanalysis.exception.ModelConfigurationException;
import com.flamingo.ai.policyanalysis.exception.SchemaValidationException;
import com.flamingo.ai.policyanalysis.exception.TransientCallException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Retry policy for model calls and the classification of call failures it relies on.
 *
 * <p>Transient failures (timeouts, rate limits, transport errors, malformed responses, a full
 * bulkhead) are retried, and so are schema violations since a second sample usually conforms.
 * Configuration errors, cancellations and provider errors LangChain4j marks non-retriable fail
 * immediately.
 */
public final class ModelCallPolicies {

  private ModelCallPolicies() {}

  /** Exponential backoff: {@code initialInterval * multiplier^(attempt - 1)}. */
  public static RetryConfig retryConfig(AnalysisConfig.Retry retry) {
    return RetryConfig.custom()
        .maxAttempts(retry.getMaxAttempts())
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                retry.getInitialInterval(), retry.getMultiplier()))
        .retryOnException(ModelCallPolicies::isRetryable)
        .build();
  }

  public static boolean isRetryable(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof ModelConfigurationException
        || cause instanceof NonRetriableException
        || cause instanceof CancellationException) {
      return false;
    }
    return cause instanceof SchemaValidationException || isTransient(cause);
  }

  /** Whether {@code error} is a failure that may go away on its own. */
  public static boolean isTransient(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof TransientCallException
        || cause instanceof RetriableException
        || cause instanceof BulkheadFullException
        || cause instanceof TimeoutException
        || cause instanceof IOException
        || cause instanceof UncheckedIOException) {
      return true;
    }
    // Anything else the transport throws that we do not recognise
    return cause instanceof RuntimeException
        && !(cause instanceof AnalysisException)
        && !(cause instanceof NonRetriableException)
        && !(cause instanceof IllegalArgumentException)
        && !(cause instanceof IllegalStateException);
  }

  public static boolean isRateLimited(Throwable error) {
    Throwable cause = unwrap(error);
    return cause instanceof RateLimitException
        || (cause instanceof TransientCallException transientCall && transientCall.isRateLimited());
  }

  /** Strips the wrappers that {@code CompletableFuture} adds around a failure. */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
