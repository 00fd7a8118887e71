package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Effects of a bill on local government operations and budgets. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LocalGovernmentImpacts(
    List<String> administrative, List<String> fiscal, List<String> implementation) {

  public LocalGovernmentImpacts {
    administrative = Lists.orEmpty(administrative);
    fiscal = Lists.orEmpty(fiscal);
    implementation = Lists.orEmpty(implementation);
  }

  public static LocalGovernmentImpacts empty() {
    return new LocalGovernmentImpacts(List.of(), List.of(), List.of());
  }
}
