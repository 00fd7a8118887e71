package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.service.analysis.model.EconomicImpacts;
import com.flamingo.ai.policyanalysis.service.analysis.model.ImpactSummary;
import com.flamingo.ai.policyanalysis.service.analysis.model.KeyPoint;
import com.flamingo.ai.policyanalysis.service.analysis.model.LocalGovernmentImpacts;
import com.flamingo.ai.policyanalysis.service.analysis.model.PublicHealthImpacts;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Merges per-chunk analyses into one. Pure: the result depends only on the inputs, never on the
 * order in which chunk calls completed.
 *
 * <p>Field rules, applied after sorting by chunk index:
 *
 * <ul>
 *   <li>summary: non-blank summaries joined by a blank line, capped at {@code
 *       analysis.merge.max-summary-chars}
 *   <li>lists: union in chunk order, de-duplicated on normalized text (first occurrence wins) and
 *       capped per field
 *   <li>impact summary: the most severe level; ties go to the lowest chunk index
 *   <li>confidence: mean weighted by each chunk's token share, rounded to 4 decimals
 *   <li>insufficient text: only if every chunk reported it
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class AnalysisMerger {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");
  private static final String ELLIPSIS = "...";

  private final AnalysisConfig analysisConfig;

  /**
   * Merges {@code results}.
   *
   * @param results successful chunk results in any order; must not be empty
   * @return the merged analysis, carrying the first chunk's model id and no processing time
   */
  public StructuredAnalysis merge(List<ChunkResult> results) {
    if (results.isEmpty()) {
      throw new IllegalArgumentException("Nothing to merge");
    }
    AnalysisConfig.Merge caps = analysisConfig.getMerge();
    List<ChunkResult> ordered = sorted(results);
    List<StructuredAnalysis> analyses = ordered.stream().map(ChunkResult::analysis).toList();

    int section = caps.getMaxSectionItems();

    PublicHealthImpacts publicHealth =
        new PublicHealthImpacts(
            union(analyses, a -> a.publicHealthImpacts().directEffects(), section),
            union(analyses, a -> a.publicHealthImpacts().indirectEffects(), section),
            union(analyses, a -> a.publicHealthImpacts().fundingImpact(), section),
            union(analyses, a -> a.publicHealthImpacts().vulnerablePopulations(), section));
    LocalGovernmentImpacts localGovernment =
        new LocalGovernmentImpacts(
            union(analyses, a -> a.localGovernmentImpacts().administrative(), section),
            union(analyses, a -> a.localGovernmentImpacts().fiscal(), section),
            union(analyses, a -> a.localGovernmentImpacts().implementation(), section));
    EconomicImpacts economic =
        new EconomicImpacts(
            union(analyses, a -> a.economicImpacts().directCosts(), section),
            union(analyses, a -> a.economicImpacts().economicEffects(), section),
            union(analyses, a -> a.economicImpacts().benefits(), section),
            union(analyses, a -> a.economicImpacts().longTermImpact(), section));

    return new StructuredAnalysis(
        mergeSummary(orderedSummaries(ordered), caps.getMaxSummaryChars()),
        mergeKeyPoints(analyses, caps.getMaxKeyPoints()),
        publicHealth,
        localGovernment,
        economic,
        union(analyses, StructuredAnalysis::environmentalImpacts, caps.getMaxFlatImpacts()),
        union(analyses, StructuredAnalysis::educationImpacts, caps.getMaxFlatImpacts()),
        union(analyses, StructuredAnalysis::infrastructureImpacts, caps.getMaxFlatImpacts()),
        union(analyses, StructuredAnalysis::recommendedActions, caps.getMaxRecommendedActions()),
        union(analyses, StructuredAnalysis::immediateActions, caps.getMaxOtherActions()),
        union(analyses, StructuredAnalysis::resourceNeeds, caps.getMaxOtherActions()),
        mostSevere(analyses),
        weightedConfidence(ordered),
        analyses.get(0).modelId(),
        0L,
        analyses.stream().allMatch(StructuredAnalysis::insufficientText));
  }

  /**
   * Non-blank chunk summaries in chunk order, excluding the insufficient-text marker. These feed
   * both the concatenated summary and the synthesis prompt.
   */
  public List<String> orderedSummaries(List<ChunkResult> results) {
    return sorted(results).stream()
        .map(result -> result.analysis().summary())
        .filter(summary -> !summary.isBlank())
        .filter(summary -> !StructuredAnalysis.INSUFFICIENT_TEXT_MARKER.equals(summary))
        .toList();
  }

  static String normalize(String text) {
    String collapsed = WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    return TRAILING_PUNCTUATION.matcher(collapsed).replaceAll("");
  }

  // ---- field rules ----

  private List<ChunkResult> sorted(List<ChunkResult> results) {
    List<ChunkResult> ordered = new ArrayList<>(results);
    ordered.sort(Comparator.comparingInt(ChunkResult::index));
    return ordered;
  }

  private String mergeSummary(List<String> summaries, int maxChars) {
    if (summaries.isEmpty()) {
      return StructuredAnalysis.INSUFFICIENT_TEXT_MARKER;
    }
    String joined = String.join("\n\n", summaries);
    if (joined.length() <= maxChars) {
      return joined;
    }
    return joined.substring(0, Math.max(0, maxChars - ELLIPSIS.length())).stripTrailing()
        + ELLIPSIS;
  }

  private List<KeyPoint> mergeKeyPoints(List<StructuredAnalysis> analyses, int cap) {
    Map<String, KeyPoint> unique = new LinkedHashMap<>();
    for (StructuredAnalysis analysis : analyses) {
      for (KeyPoint keyPoint : analysis.keyPoints()) {
        String key = normalize(keyPoint.point());
        if (!key.isEmpty()) {
          unique.putIfAbsent(key, keyPoint);
        }
      }
    }
    return unique.values().stream().limit(cap).toList();
  }

  private List<String> union(
      List<StructuredAnalysis> analyses,
      Function<StructuredAnalysis, List<String>> field,
      int cap) {
    Map<String, String> unique = new LinkedHashMap<>();
    for (StructuredAnalysis analysis : analyses) {
      for (String item : field.apply(analysis)) {
        String key = normalize(item);
        if (!key.isEmpty()) {
          unique.putIfAbsent(key, item.strip());
        }
      }
    }
    return unique.values().stream().limit(cap).toList();
  }

  private ImpactSummary mostSevere(List<StructuredAnalysis> analyses) {
    ImpactSummary winner = analyses.get(0).impactSummary();
    for (StructuredAnalysis analysis : analyses) {
      ImpactSummary candidate = analysis.impactSummary();
      if (candidate.impactLevel().compareTo(winner.impactLevel()) > 0) {
        winner = candidate;
      }
    }
    return winner;
  }

  private double weightedConfidence(List<ChunkResult> results) {
    long totalTokens = results.stream().mapToLong(ChunkResult::tokenCount).sum();
    double confidence;
    if (totalTokens <= 0) {
      confidence =
          results.stream().mapToDouble(r -> r.analysis().confidenceScore()).average().orElse(0.0);
    } else {
      double weighted = 0.0;
      for (ChunkResult result : results) {
        weighted += result.analysis().confidenceScore() * result.tokenCount();
      }
      confidence = weighted / totalTokens;
    }
    return Math.round(confidence * 10_000) / 10_000.0;
  }
}
