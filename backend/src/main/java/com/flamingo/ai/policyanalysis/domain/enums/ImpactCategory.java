package com.flamingo.ai.policyanalysis.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Primary area a bill affects. */
public enum ImpactCategory {
  PUBLIC_HEALTH("public_health"),
  LOCAL_GOV("local_gov"),
  ECONOMIC("economic"),
  ENVIRONMENTAL("environmental"),
  EDUCATION("education"),
  INFRASTRUCTURE("infrastructure");

  private final String value;

  ImpactCategory(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ImpactCategory fromValue(String value) {
    for (ImpactCategory candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ImpactCategory: " + value);
  }
}
