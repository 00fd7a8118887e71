package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.policyanalysis.domain.enums.ImpactCategory;
import com.flamingo.ai.policyanalysis.domain.enums.ImpactLevel;
import com.flamingo.ai.policyanalysis.domain.enums.TexasRelevance;

/**
 * Overall classification of a bill.
 *
 * @param primaryCategory the area most affected
 * @param impactLevel how severe the impact is
 * @param relevanceToTexas how much the bill matters to Texas agencies
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImpactSummary(
    ImpactCategory primaryCategory, ImpactLevel impactLevel, TexasRelevance relevanceToTexas) {

  public ImpactSummary {
    primaryCategory = primaryCategory == null ? ImpactCategory.PUBLIC_HEALTH : primaryCategory;
    impactLevel = impactLevel == null ? ImpactLevel.LOW : impactLevel;
    relevanceToTexas = relevanceToTexas == null ? TexasRelevance.LOW : relevanceToTexas;
  }

  /** Conservative assessment used when nothing better is known. */
  public static ImpactSummary conservative() {
    return new ImpactSummary(ImpactCategory.PUBLIC_HEALTH, ImpactLevel.LOW, TexasRelevance.LOW);
  }
}
