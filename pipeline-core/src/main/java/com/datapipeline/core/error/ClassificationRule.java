package com.datapipeline.core.error;

import java.util.Objects;
import java.util.function.Predicate;

public record ClassificationRule(String name, Predicate<ErrorSignal> matcher, ErrorClassification classification) {
  public ClassificationRule {
    name = Objects.requireNonNull(name, "name");
    matcher = Objects.requireNonNull(matcher, "matcher");
    classification = Objects.requireNonNull(classification, "classification");
  }

  public boolean matches(ErrorSignal signal) {
    return matcher.test(signal);
  }
}
