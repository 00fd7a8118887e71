package com.flamingo.ai.policyanalysis.service.analysis.model;

import java.util.List;
import java.util.Objects;

final class Lists {

  private Lists() {}

  static <T> List<T> orEmpty(List<T> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream().filter(Objects::nonNull).toList();
  }
}
