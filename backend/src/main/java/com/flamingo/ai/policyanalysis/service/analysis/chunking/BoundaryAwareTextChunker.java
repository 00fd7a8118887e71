package com.flamingo.ai.policyanalysis.service.analysis.chunking;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.exception.ContentProcessingException;
import com.flamingo.ai.policyanalysis.service.analysis.token.TokenCounter;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TextChunker} that cuts at the most natural boundary that keeps each chunk within budget.
 *
 * <p>The text is first cut into units at paragraph breaks (a blank-line run stays with the
 * paragraph before it). When the document is structured, i.e. one of the legislative heading
 * patterns occurs more than {@code analysis.chunking.structure-threshold} times, units are also
 * cut in front of every heading so sections start new units. Units are packed greedily until the
 * next one would overflow the budget.
 *
 * <p>A unit that alone exceeds the budget is split at sentence boundaries, and a sentence that
 * still exceeds it is hard-split at the longest prefix that fits, preferring a whitespace cut.
 * Hard-split pieces are flagged on the resulting {@link TextChunk}.
 *
 * <p>Every cut is a character offset into the original text, so concatenating the chunks always
 * reproduces it exactly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoundaryAwareTextChunker implements TextChunker {

  private static final List<Pattern> HEADING_PATTERNS =
      List.of(
          Pattern.compile(
              "(?m)^[ \\t]*(?:Section|SEC\\.|SECTION|Article|ARTICLE|Title|TITLE)\\s+\\d+\\.?"),
          Pattern.compile("(?m)^[ \\t]*§+\\s*\\d+"),
          Pattern.compile("(?m)^[ \\t]*\\d+\\.\\s+[A-Z]"),
          Pattern.compile("(?m)^[ \\t]*[A-Z][A-Z ]{3,}[ \\t]*$"));

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\r?\\n\\s*");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

  /** Share of a hard-split prefix searched backwards for a whitespace cut. */
  private static final double WHITESPACE_WINDOW = 0.2;

  private final TokenCounter tokenCounter;
  private final AnalysisConfig analysisConfig;

  private enum Level {
    UNIT,
    SENTENCE
  }

  private record Span(int start, int end, int tokens, boolean hardSplit) {}

  @Override
  public ChunkingResult split(String text, int maxTokensPerChunk, String modelId) {
    if (maxTokensPerChunk <= 0) {
      throw new IllegalArgumentException("maxTokensPerChunk must be positive");
    }
    if (text == null || text.isEmpty()) {
      return new ChunkingResult(List.of(), false);
    }

    try {
      boolean structured = isStructured(text);
      List<Span> spans = new ArrayList<>();
      pack(text, 0, text.length(), unitCuts(text, structured), Level.UNIT, maxTokensPerChunk,
          modelId, spans);

      List<TextChunk> chunks = new ArrayList<>(spans.size());
      for (Span span : spans) {
        chunks.add(
            new TextChunk(
                chunks.size(),
                text.substring(span.start(), span.end()),
                span.start(),
                span.end(),
                span.tokens(),
                span.hardSplit()));
      }

      ChunkingResult result = new ChunkingResult(chunks, structured);
      log.info(
          "Split {} chars into {} chunks (budget {} tokens, structured={})",
          text.length(),
          result.size(),
          maxTokensPerChunk,
          structured);
      if (result.hardSplitCount() > 0) {
        log.warn(
            "{} chunks were hard-split inside a sentence to fit {} tokens",
            result.hardSplitCount(),
            maxTokensPerChunk);
      }
      return result;
    } catch (RuntimeException e) {
      log.error("Error splitting text into chunks: {}", e.getMessage());
      throw new ContentProcessingException(
          null, "Error splitting text into chunks: " + e.getMessage(), e);
    }
  }

  boolean isStructured(String text) {
    int threshold = analysisConfig.getChunking().getStructureThreshold();
    for (Pattern pattern : HEADING_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      int matches = 0;
      while (matcher.find()) {
        if (++matches > threshold) {
          return true;
        }
      }
    }
    return false;
  }

  // ---- cut points ----

  private List<Integer> unitCuts(String text, boolean structured) {
    TreeSet<Integer> cuts = new TreeSet<>();
    Matcher paragraphs = PARAGRAPH_BREAK.matcher(text);
    while (paragraphs.find()) {
      cuts.add(paragraphs.end());
    }
    if (structured) {
      for (Pattern pattern : HEADING_PATTERNS) {
        Matcher headings = pattern.matcher(text);
        while (headings.find()) {
          cuts.add(headings.start());
        }
      }
    }
    cuts.removeIf(cut -> cut <= 0 || cut >= text.length());
    return new ArrayList<>(cuts);
  }

  private List<Integer> sentenceCuts(String text, int from, int to) {
    List<Integer> cuts = new ArrayList<>();
    Matcher sentences = SENTENCE_BREAK.matcher(text).region(from, to);
    while (sentences.find()) {
      if (sentences.end() > from && sentences.end() < to) {
        cuts.add(sentences.end());
      }
    }
    return cuts;
  }

  // ---- greedy packing ----

  private void pack(
      String text,
      int from,
      int to,
      List<Integer> cuts,
      Level level,
      int budget,
      String modelId,
      List<Span> out) {
    int chunkStart = -1;
    int chunkEnd = -1;
    int chunkTokens = 0;
    int segmentStart = from;

    List<Integer> boundaries = new ArrayList<>(cuts.size() + 1);
    for (int cut : cuts) {
      if (cut > from && cut < to) {
        boundaries.add(cut);
      }
    }
    boundaries.add(to);

    for (int segmentEnd : boundaries) {
      if (segmentEnd <= segmentStart) {
        continue;
      }
      int segmentTokens = tokenCounter.count(text.substring(segmentStart, segmentEnd), modelId);

      if (chunkStart >= 0 && chunkTokens + segmentTokens <= budget) {
        chunkEnd = segmentEnd;
        chunkTokens += segmentTokens;
      } else {
        if (chunkStart >= 0) {
          close(text, chunkStart, chunkEnd, level, budget, modelId, out);
          chunkStart = -1;
        }
        if (segmentTokens <= budget) {
          chunkStart = segmentStart;
          chunkEnd = segmentEnd;
          chunkTokens = segmentTokens;
        } else {
          splitOversized(text, segmentStart, segmentEnd, level, budget, modelId, out);
        }
      }
      segmentStart = segmentEnd;
    }

    if (chunkStart >= 0) {
      close(text, chunkStart, chunkEnd, level, budget, modelId, out);
    }
  }

  /**
   * Emits a packed span with its exact token count. Packing sums per-segment counts; if the joined
   * span tokenizes longer than the sum, it is re-split one level down instead of overflowing.
   */
  private void close(
      String text, int start, int end, Level level, int budget, String modelId, List<Span> out) {
    int exact = tokenCounter.count(text.substring(start, end), modelId);
    if (exact <= budget) {
      out.add(new Span(start, end, exact, false));
    } else {
      splitOversized(text, start, end, level, budget, modelId, out);
    }
  }

  private void splitOversized(
      String text, int start, int end, Level level, int budget, String modelId, List<Span> out) {
    if (level == Level.UNIT) {
      log.debug("Unit [{}, {}) exceeds {} tokens, splitting by sentences", start, end, budget);
      pack(text, start, end, sentenceCuts(text, start, end), Level.SENTENCE, budget, modelId, out);
    } else {
      hardSplit(text, start, end, budget, modelId, out);
    }
  }

  // ---- last resort ----

  private void hardSplit(
      String text, int start, int end, int budget, String modelId, List<Span> out) {
    int position = start;
    while (position < end) {
      int cut = longestFittingPrefix(text, position, end, budget, modelId);
      int tokens = tokenCounter.count(text.substring(position, cut), modelId);
      out.add(new Span(position, cut, tokens, true));
      position = cut;
    }
  }

  private int longestFittingPrefix(String text, int start, int end, int budget, String modelId) {
    int low = start + Character.charCount(text.codePointAt(start));
    if (tokenCounter.count(text.substring(start, low), modelId) > budget) {
      // Not even one code point fits; emit it alone and let the flag report the overflow
      return low;
    }

    int high = end;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (tokenCounter.count(text.substring(start, mid), modelId) <= budget) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    int cut = low;

    if (cut < end) {
      int windowStart = Math.max(start + 1, cut - (int) ((cut - start) * WHITESPACE_WINDOW));
      for (int i = cut - 1; i >= windowStart; i--) {
        if (Character.isWhitespace(text.charAt(i))) {
          cut = i + 1;
          break;
        }
      }
      if (Character.isHighSurrogate(text.charAt(cut - 1)) && cut - 1 > start) {
        cut--;
      }
    }
    return cut;
  }
}
