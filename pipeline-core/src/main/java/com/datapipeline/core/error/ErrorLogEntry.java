package com.datapipeline.core.error;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ErrorLogEntry(
    String id,
    Instant timestamp,
    Throwable error,
    Map<String, Object> context,
    ErrorClassification classification,
    int recoveryAttempts,
    boolean resolved
) {
  public ErrorLogEntry {
    id = Objects.requireNonNull(id, "id");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    error = Objects.requireNonNull(error, "error");
    context = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(context, "context")));
    classification = Objects.requireNonNull(classification, "classification");
  }

  public String message() {
    return String.valueOf(error.getMessage());
  }

  public String errorClass() {
    return error.getClass().getName();
  }

  ErrorLogEntry withRecovery(int attempts, boolean isResolved) {
    return new ErrorLogEntry(id, timestamp, error, context, classification, attempts, isResolved);
  }
}
