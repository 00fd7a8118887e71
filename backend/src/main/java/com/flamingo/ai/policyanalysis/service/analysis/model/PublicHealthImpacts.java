package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Effects of a bill on public health agencies and the populations they serve. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublicHealthImpacts(
    List<String> directEffects,
    List<String> indirectEffects,
    List<String> fundingImpact,
    List<String> vulnerablePopulations) {

  public PublicHealthImpacts {
    directEffects = Lists.orEmpty(directEffects);
    indirectEffects = Lists.orEmpty(indirectEffects);
    fundingImpact = Lists.orEmpty(fundingImpact);
    vulnerablePopulations = Lists.orEmpty(vulnerablePopulations);
  }

  public static PublicHealthImpacts empty() {
    return new PublicHealthImpacts(List.of(), List.of(), List.of(), List.of());
  }
}
