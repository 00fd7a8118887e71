package com.flamingo.ai.policyanalysis.service.analysis.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.service.analysis.token.TokenCounter;
import java.util.Collections;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BoundaryAwareTextChunker Tests")
class BoundaryAwareTextChunkerTest {

  private static final String MODEL = "gpt-4o";

  /** One token per whitespace-separated word. */
  private final TokenCounter wordCounter =
      (text, model) -> text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;

  private BoundaryAwareTextChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new BoundaryAwareTextChunker(wordCounter, new AnalysisConfig());
  }

  @Test
  @DisplayName("should return no chunks for empty text")
  void shouldReturnNoChunks_whenTextEmpty() {
    assertThat(chunker.split("", 100, MODEL).chunks()).isEmpty();
  }

  @Test
  @DisplayName("should reject a non-positive budget")
  void shouldReject_whenBudgetNotPositive() {
    assertThatThrownBy(() -> chunker.split("text", 0, MODEL))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should split 10,000 tokens into 5 chunks at a 2,000 token budget")
  void shouldSplitIntoFiveChunks_whenDocumentIsFiveBudgetsLong() {
    // 100 paragraphs of 100 words each
    String paragraph = String.join(" ", Collections.nCopies(100, "word"));
    String text =
        IntStream.range(0, 100).mapToObj(i -> paragraph).collect(Collectors.joining("\n\n"));

    ChunkingResult result = chunker.split(text, 2_000, MODEL);

    assertThat(result.chunks()).hasSize(5);
    assertThat(result.chunks())
        .allSatisfy(chunk -> assertThat(chunk.tokenCount()).isLessThanOrEqualTo(2_000));
    assertThat(result.hardSplitCount()).isZero();
    assertThat(result.totalTokens()).isEqualTo(10_000);
  }

  @Test
  @DisplayName("should reproduce the input exactly when chunks are concatenated")
  void shouldReproduceInput_whenChunksConcatenated() {
    String text =
        "SECTION 1. Short title.\n\nThis Act may be cited as the Rural Health Act.  \n\n\n"
            + "SECTION 2. Definitions. In this Act the following terms apply. A clinic is a"
            + " facility. A district is a hospital district.\r\n\r\n"
            + "SECTION 3. Funding. The department shall allocate funds to each district.\n";

    ChunkingResult result = chunker.split(text, 12, MODEL);

    String joined = result.chunks().stream().map(TextChunk::text).collect(Collectors.joining());
    assertThat(joined).isEqualTo(text);
    for (int i = 0; i < result.size(); i++) {
      TextChunk chunk = result.chunks().get(i);
      assertThat(chunk.index()).isEqualTo(i);
      assertThat(text.substring(chunk.startOffset(), chunk.endOffset())).isEqualTo(chunk.text());
      if (i > 0) {
        assertThat(chunk.startOffset()).isEqualTo(result.chunks().get(i - 1).endOffset());
      }
    }
  }

  @Test
  @DisplayName("should keep chunks within budget unless they are flagged as hard splits")
  void shouldRespectBudget_unlessHardSplit() {
    String runOn =
        IntStream.range(0, 50).mapToObj(i -> "clause" + i).collect(Collectors.joining(" "));
    String text = "A short opening paragraph.\n\n" + runOn + "\n\nA closing paragraph here.";

    ChunkingResult result = chunker.split(text, 10, MODEL);

    assertThat(result.hardSplitCount()).isPositive();
    assertThat(result.chunks())
        .filteredOn(chunk -> !chunk.hardSplit())
        .allSatisfy(chunk -> assertThat(chunk.tokenCount()).isLessThanOrEqualTo(10));
    assertThat(result.chunks())
        .filteredOn(TextChunk::hardSplit)
        .allSatisfy(chunk -> assertThat(chunk.tokenCount()).isLessThanOrEqualTo(10));
    assertThat(result.chunks().stream().map(TextChunk::text).collect(Collectors.joining()))
        .isEqualTo(text);
  }

  @Test
  @DisplayName("should split an oversized paragraph at sentence boundaries before hard splitting")
  void shouldSplitAtSentences_whenParagraphTooLarge() {
    String text =
        "The agency shall publish a report. The report must include costs. "
            + "Counties may apply for grants. Grants expire after two years.";

    ChunkingResult result = chunker.split(text, 13, MODEL);

    assertThat(result.hardSplitCount()).isZero();
    assertThat(result.chunks()).hasSizeGreaterThan(1);
    assertThat(result.chunks())
        .allSatisfy(chunk -> assertThat(chunk.text().strip()).endsWith("."));
  }

  @Test
  @DisplayName("should detect legislative structure when headings repeat often enough")
  void shouldDetectStructure_whenHeadingsRepeat() {
    StringBuilder text = new StringBuilder();
    for (int i = 1; i <= 5; i++) {
      text.append("SECTION ").append(i).append(". The board shall act.\n");
    }

    assertThat(chunker.split(text.toString(), 1_000, MODEL).structured()).isTrue();
    assertThat(chunker.split("SECTION 1. Only one heading.", 1_000, MODEL).structured()).isFalse();
  }

  @Test
  @DisplayName("should start sections on new chunks when the document is structured")
  void shouldCutBeforeHeadings_whenStructured() {
    StringBuilder text = new StringBuilder();
    for (int i = 1; i <= 4; i++) {
      text.append("SECTION ").append(i).append(". The board shall adopt rule ");
      text.append(i).append(".\n");
    }

    ChunkingResult result = chunker.split(text.toString(), 9, MODEL);

    assertThat(result.structured()).isTrue();
    assertThat(result.chunks())
        .allSatisfy(chunk -> assertThat(chunk.text()).startsWith("SECTION"));
  }

  @Test
  @DisplayName("should never split a surrogate pair when hard splitting")
  void shouldNotSplitSurrogatePair_whenHardSplitting() {
    // Every code point counts as a token so the budget forces cuts between emoji
    TokenCounter codePoints = (text, model) -> text.codePointCount(0, text.length());
    BoundaryAwareTextChunker perCodePoint =
        new BoundaryAwareTextChunker(codePoints, new AnalysisConfig());
    String text = "📜".repeat(7);

    ChunkingResult result = perCodePoint.split(text, 2, MODEL);

    assertThat(result.chunks()).allSatisfy(chunk -> {
      assertThat(Character.isLowSurrogate(chunk.text().charAt(0))).isFalse();
      assertThat(Character.isHighSurrogate(chunk.text().charAt(chunk.text().length() - 1)))
          .isFalse();
    });
    assertThat(result.chunks().stream().map(TextChunk::text).collect(Collectors.joining()))
        .isEqualTo(text);
  }
}
