package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.policyanalysis.domain.enums.ImpactType;

/**
 * A single key provision of a bill, tagged with its impact polarity.
 *
 * @param point the provision, in one sentence
 * @param impactType whether the provision helps, harms or is neutral for the affected parties
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record KeyPoint(String point, ImpactType impactType) {

  public KeyPoint {
    point = point == null ? "" : point.trim();
    impactType = impactType == null ? ImpactType.NEUTRAL : impactType;
  }
}
