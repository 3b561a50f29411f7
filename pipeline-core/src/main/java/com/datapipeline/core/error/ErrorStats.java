package com.datapipeline.core.error;

import java.util.Map;

public record ErrorStats(
    long totalErrors,
    Map<ErrorType, Long> errorsByType,
    Map<ErrorSeverity, Long> errorsBySeverity,
    long recoveryAttempts,
    long successfulRecoveries,
    long failedRecoveries
) {
  public ErrorStats {
    errorsByType = Map.copyOf(errorsByType);
    errorsBySeverity = Map.copyOf(errorsBySeverity);
  }

  public long countOf(ErrorType type) {
    return errorsByType.getOrDefault(type, 0L);
  }

  public long countOf(ErrorSeverity severity) {
    return errorsBySeverity.getOrDefault(severity, 0L);
  }
}
