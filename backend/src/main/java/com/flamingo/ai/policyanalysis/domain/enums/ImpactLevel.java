package com.flamingo.ai.policyanalysis.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a bill's impact, in ascending order. */
public enum ImpactLevel {
  LOW("low"),
  MODERATE("moderate"),
  HIGH("high"),
  CRITICAL("critical");

  private final String value;

  ImpactLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ImpactLevel fromValue(String value) {
    for (ImpactLevel candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ImpactLevel: " + value);
  }
}
