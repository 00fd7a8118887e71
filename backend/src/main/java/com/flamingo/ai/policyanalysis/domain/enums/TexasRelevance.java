package com.flamingo.ai.policyanalysis.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How relevant a bill is to Texas public health and local government. */
public enum TexasRelevance {
  LOW("low"),
  MODERATE("moderate"),
  HIGH("high");

  private final String value;

  TexasRelevance(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TexasRelevance fromValue(String value) {
    for (TexasRelevance candidate : values()) {
      if (candidate.value.equalsIgnoreCase(value)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown TexasRelevance: " + value);
  }
}
