package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Economic costs and benefits of a bill. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EconomicImpacts(
    List<String> directCosts,
    List<String> economicEffects,
    List<String> benefits,
    List<String> longTermImpact) {

  public EconomicImpacts {
    directCosts = Lists.orEmpty(directCosts);
    economicEffects = Lists.orEmpty(economicEffects);
    benefits = Lists.orEmpty(benefits);
    longTermImpact = Lists.orEmpty(longTermImpact);
  }

  public static EconomicImpacts empty() {
    return new EconomicImpacts(List.of(), List.of(), List.of(), List.of());
  }
}
