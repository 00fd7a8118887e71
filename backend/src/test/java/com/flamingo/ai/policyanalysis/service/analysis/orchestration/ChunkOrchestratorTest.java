package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import static com.flamingo.ai.policyanalysis.service.analysis.AnalysisFixtures.analysis;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.domain.enums.DropReason;
import com.flamingo.ai.policyanalysis.domain.enums.ImpactLevel;
import com.flamingo.ai.policyanalysis.exception.AllChunksFailedException;
import com.flamingo.ai.policyanalysis.exception.ModelCallFailedException;
import com.flamingo.ai.policyanalysis.exception.SchemaValidationException;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisFixtures;
import com.flamingo.ai.policyanalysis.service.analysis.chunking.TextChunk;
import com.flamingo.ai.policyanalysis.service.analysis.client.ModelClient;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBuilder;
import com.flamingo.ai.policyanalysis.service.analysis.prompt.PromptBundle;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.IntFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkOrchestrator Tests")
class ChunkOrchestratorTest {

  private static final String MODEL = AnalysisFixtures.MODEL;
  private static final Duration DEADLINE = Duration.ofSeconds(10);

  @Mock private ModelClient modelClient;

  private AnalysisConfig analysisConfig;
  private ChunkOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    analysisConfig = new AnalysisConfig();
    analysisConfig.getMerge().setSynthesizeSummary(false);
    orchestrator =
        new ChunkOrchestrator(
            modelClient, new PromptBuilder(), new AnalysisMerger(analysisConfig), analysisConfig);
  }

  @Test
  @DisplayName("should merge every chunk when all calls succeed")
  void shouldMergeAllChunks_whenAllSucceed() {
    answerChunks(i -> CompletableFuture.completedFuture(chunkAnalysis(i)));

    ChunkedAnalysis result = run(5, DEADLINE);

    assertThat(result.contributingIndices()).containsExactly(0, 1, 2, 3, 4);
    assertThat(result.dropped()).isEmpty();
    assertThat(result.isPartial()).isFalse();
    assertThat(result.analysis().summary()).startsWith("Chunk 0.").endsWith("Chunk 4.");
  }

  @Test
  @DisplayName("should tell each chunk prompt its position in the document")
  void shouldLabelPositions_whenDispatching() {
    answerChunks(i -> CompletableFuture.completedFuture(chunkAnalysis(i)));

    run(3, DEADLINE);

    ArgumentCaptor<PromptBundle> prompts = ArgumentCaptor.forClass(PromptBundle.class);
    verify(modelClient, times(3))
        .analyze(prompts.capture(), any(), anyString(), any());
    assertThat(prompts.getAllValues().get(0).userPrompt()).contains("PART 1 OF 3");
    assertThat(prompts.getAllValues().get(2).userPrompt()).contains("THE FINAL PART (3 OF 3)");
  }

  @Test
  @DisplayName("should drop a failed chunk and merge the rest")
  void shouldReturnPartialResult_whenOneChunkFails() {
    answerChunks(
        i ->
            i == 2
                ? CompletableFuture.failedFuture(
                    new ModelCallFailedException("gave up", 2, 4, false, null))
                : CompletableFuture.completedFuture(chunkAnalysis(i)));

    ChunkedAnalysis result = run(5, DEADLINE);

    assertThat(result.contributingIndices()).containsExactly(0, 1, 3, 4);
    assertThat(result.isPartial()).isTrue();
    assertThat(result.dropped())
        .singleElement()
        .satisfies(
            dropped -> {
              assertThat(dropped.index()).isEqualTo(2);
              assertThat(dropped.reason()).isEqualTo(DropReason.CALL_FAILED);
              assertThat(dropped.errorType()).isEqualTo("chunk_failed");
            });
    assertThat(result.analysis().summary()).doesNotContain("Chunk 2.");
  }

  @Test
  @DisplayName("should mark a chunk whose responses never conform as schema-invalid")
  void shouldDropAsSchemaInvalid_whenSchemaNeverSatisfied() {
    answerChunks(
        i ->
            i == 0
                ? CompletableFuture.failedFuture(
                    new SchemaValidationException(List.of("$.summary: missing")))
                : CompletableFuture.completedFuture(chunkAnalysis(i)));

    ChunkedAnalysis result = run(2, DEADLINE);

    assertThat(result.dropped())
        .extracting(DroppedChunk::reason)
        .containsExactly(DropReason.SCHEMA_INVALID);
  }

  @Test
  @DisplayName("should fail when every chunk fails")
  void shouldFailWithAllChunksFailed_whenNoChunkSucceeds() {
    answerChunks(
        i -> CompletableFuture.failedFuture(new ModelCallFailedException("no", i, 4, true, null)));

    CompletableFuture<ChunkedAnalysis> future =
        orchestrator.analyzeChunked(
            chunks(3), AnalysisFixtures.metadata(), true, MODEL, DEADLINE);

    assertThatThrownBy(future::join)
        .isInstanceOf(CompletionException.class)
        .cause()
        .isInstanceOfSatisfying(
            AllChunksFailedException.class,
            e -> assertThat(e.getFailures()).containsOnlyKeys(0, 1, 2));
  }

  @Test
  @DisplayName("should cancel calls still running at the deadline and merge the rest")
  void shouldDropSlowChunks_whenDeadlinePasses() {
    CompletableFuture<StructuredAnalysis> neverCompletes = new CompletableFuture<>();
    answerChunks(
        i -> i == 1 ? neverCompletes : CompletableFuture.completedFuture(chunkAnalysis(i)));

    ChunkedAnalysis result = run(3, Duration.ofMillis(200));

    assertThat(result.contributingIndices()).containsExactly(0, 2);
    assertThat(result.dropped())
        .extracting(DroppedChunk::reason)
        .containsExactly(DropReason.DEADLINE_EXCEEDED);
    assertThat(neverCompletes).isCancelled();
  }

  @Test
  @DisplayName("should replace the summary when synthesis succeeds")
  void shouldUseSynthesizedSummary_whenSynthesisSucceeds() {
    analysisConfig.getMerge().setSynthesizeSummary(true);
    answerChunks(i -> CompletableFuture.completedFuture(chunkAnalysis(i)));
    when(modelClient.synthesize(any(), anyString()))
        .thenReturn(CompletableFuture.completedFuture("One coherent summary."));

    ChunkedAnalysis result = run(3, DEADLINE);

    assertThat(result.summarySynthesized()).isTrue();
    assertThat(result.analysis().summary()).isEqualTo("One coherent summary.");
  }

  @Test
  @DisplayName("should keep the concatenated summary when synthesis fails")
  void shouldKeepConcatenatedSummary_whenSynthesisFails() {
    analysisConfig.getMerge().setSynthesizeSummary(true);
    answerChunks(i -> CompletableFuture.completedFuture(chunkAnalysis(i)));
    when(modelClient.synthesize(any(), anyString()))
        .thenReturn(
            CompletableFuture.failedFuture(
                new ModelCallFailedException("down", null, 4, false, null)));

    ChunkedAnalysis result = run(2, DEADLINE);

    assertThat(result.summarySynthesized()).isFalse();
    assertThat(result.analysis().summary()).isEqualTo("Chunk 0.\n\nChunk 1.");
  }

  @Test
  @DisplayName("should cancel synthesis and keep the concatenated summary at the deadline")
  void shouldCancelSynthesis_whenDeadlinePasses() {
    analysisConfig.getMerge().setSynthesizeSummary(true);
    answerChunks(i -> CompletableFuture.completedFuture(chunkAnalysis(i)));
    CompletableFuture<String> slowSynthesis = new CompletableFuture<>();
    when(modelClient.synthesize(any(), anyString())).thenReturn(slowSynthesis);

    ChunkedAnalysis result = run(2, Duration.ofMillis(200));

    assertThat(result.summarySynthesized()).isFalse();
    assertThat(result.analysis().summary()).isEqualTo("Chunk 0.\n\nChunk 1.");
    assertThat(slowSynthesis).isCancelled();
  }

  @Test
  @DisplayName("should skip synthesis when only one summary survives")
  void shouldSkipSynthesis_whenSingleSummary() {
    analysisConfig.getMerge().setSynthesizeSummary(true);
    answerChunks(
        i ->
            i == 0
                ? CompletableFuture.completedFuture(chunkAnalysis(i))
                : CompletableFuture.failedFuture(
                    new ModelCallFailedException("no", i, 4, false, null)));

    ChunkedAnalysis result = run(2, DEADLINE);

    assertThat(result.summarySynthesized()).isFalse();
    verify(modelClient, never()).synthesize(any(), anyString());
  }

  private ChunkedAnalysis run(int chunkCount, Duration deadline) {
    return orchestrator
        .analyzeChunked(chunks(chunkCount), AnalysisFixtures.metadata(), true, MODEL, deadline)
        .join();
  }

  private void answerChunks(IntFunction<CompletableFuture<StructuredAnalysis>> answer) {
    when(modelClient.analyze(any(), any(), anyString(), any()))
        .thenAnswer(invocation -> answer.apply(invocation.<Integer>getArgument(3)));
  }

  private static StructuredAnalysis chunkAnalysis(int index) {
    return analysis("Chunk " + index + ".", ImpactLevel.MODERATE, 0.8);
  }

  private static List<TextChunk> chunks(int count) {
    List<TextChunk> chunks = new ArrayList<>();
    int offset = 0;
    for (int i = 0; i < count; i++) {
      String text = "SECTION " + (i + 1) + ". Provision text.";
      chunks.add(new TextChunk(i, text, offset, offset + text.length(), 100, false));
      offset += text.length();
    }
    return chunks;
  }
}
