package com.flamingo.ai.policyanalysis.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Polarity of a key point's impact. */
public enum ImpactType {
  POSITIVE("positive"),
  NEGATIVE("negative"),
  NEUTRAL("neutral");

  private final String value;

  ImpactType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ImpactType fromValue(String value) {
    for (ImpactType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ImpactType: " + value);
  }
}
