package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.policyanalysis.domain.enums.ImpactType;
import java.util.List;

/**
 * Canonical output of the pipeline: one fixed-shape analysis of a bill.
 *
 * <p>Every list and section is always present. Missing values from the model are normalized to
 * empty lists (or a conservative {@link ImpactSummary}) so that consumers never have to tell
 * "absent" from "empty".
 *
 * <p>{@code modelId}, {@code processingTimeMs} and {@code insufficientText} are set by the
 * pipeline after the model call; the model never produces them.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StructuredAnalysis(
    String summary,
    List<KeyPoint> keyPoints,
    PublicHealthImpacts publicHealthImpacts,
    LocalGovernmentImpacts localGovernmentImpacts,
    EconomicImpacts economicImpacts,
    List<String> environmentalImpacts,
    List<String> educationImpacts,
    List<String> infrastructureImpacts,
    List<String> recommendedActions,
    List<String> immediateActions,
    List<String> resourceNeeds,
    ImpactSummary impactSummary,
    double confidenceScore,
    String modelId,
    long processingTimeMs,
    boolean insufficientText) {

  /** Summary text the model returns when it cannot analyse the input. */
  public static final String INSUFFICIENT_TEXT_MARKER = "INSUFFICIENT_TEXT_FOR_ANALYSIS";

  private static final String UNDETERMINED = "Unable to determine due to insufficient text";

  public StructuredAnalysis {
    summary = summary == null ? "" : summary.trim();
    keyPoints = Lists.orEmpty(keyPoints);
    publicHealthImpacts =
        publicHealthImpacts == null ? PublicHealthImpacts.empty() : publicHealthImpacts;
    localGovernmentImpacts =
        localGovernmentImpacts == null ? LocalGovernmentImpacts.empty() : localGovernmentImpacts;
    economicImpacts = economicImpacts == null ? EconomicImpacts.empty() : economicImpacts;
    environmentalImpacts = Lists.orEmpty(environmentalImpacts);
    educationImpacts = Lists.orEmpty(educationImpacts);
    infrastructureImpacts = Lists.orEmpty(infrastructureImpacts);
    recommendedActions = Lists.orEmpty(recommendedActions);
    immediateActions = Lists.orEmpty(immediateActions);
    resourceNeeds = Lists.orEmpty(resourceNeeds);
    impactSummary = impactSummary == null ? ImpactSummary.conservative() : impactSummary;
    confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
  }

  /**
   * The canonical result for content too short to analyse. Reproducible, so it is cached like
   * any other result.
   */
  public static StructuredAnalysis insufficientText(String modelId, long processingTimeMs) {
    List<String> undetermined = List.of(UNDETERMINED);
    return new StructuredAnalysis(
        "Insufficient text available for detailed analysis.",
        List.of(
            new KeyPoint("Insufficient text for detailed analysis", ImpactType.NEUTRAL)),
        new PublicHealthImpacts(undetermined, undetermined, undetermined, undetermined),
        new LocalGovernmentImpacts(undetermined, undetermined, undetermined),
        new EconomicImpacts(undetermined, undetermined, undetermined, undetermined),
        undetermined,
        undetermined,
        undetermined,
        List.of("Monitor for more detailed information"),
        List.of("None required at this time"),
        List.of("None identified due to insufficient text"),
        ImpactSummary.conservative(),
        0.0,
        modelId,
        processingTimeMs,
        true);
  }

  /** Copy with pipeline-owned metadata applied. */
  public StructuredAnalysis withMetadata(String modelId, long processingTimeMs) {
    return new StructuredAnalysis(
        summary,
        keyPoints,
        publicHealthImpacts,
        localGovernmentImpacts,
        economicImpacts,
        environmentalImpacts,
        educationImpacts,
        infrastructureImpacts,
        recommendedActions,
        immediateActions,
        resourceNeeds,
        impactSummary,
        confidenceScore,
        modelId,
        processingTimeMs,
        insufficientText || INSUFFICIENT_TEXT_MARKER.equals(summary));
  }

  /** Copy with a replaced summary; used after summary synthesis. */
  public StructuredAnalysis withSummary(String newSummary) {
    return new StructuredAnalysis(
        newSummary,
        keyPoints,
        publicHealthImpacts,
        localGovernmentImpacts,
        economicImpacts,
        environmentalImpacts,
        educationImpacts,
        infrastructureImpacts,
        recommendedActions,
        immediateActions,
        resourceNeeds,
        impactSummary,
        confidenceScore,
        modelId,
        processingTimeMs,
        insufficientText);
  }
}
