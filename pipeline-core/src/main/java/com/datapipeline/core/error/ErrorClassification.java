package com.datapipeline.core.error;

import java.util.Objects;

public record ErrorClassification(ErrorType type, ErrorSeverity severity, RecoveryStrategy strategy) {
  public ErrorClassification {
    type = Objects.requireNonNull(type, "type");
    severity = Objects.requireNonNull(severity, "severity");
    strategy = Objects.requireNonNull(strategy, "strategy");
  }
}
