package com.datapipeline.core;

import java.time.Instant;
import java.util.Objects;

/** A stage that threw during an execution. Non-critical failures are kept here and nowhere else. */
public record StageFailure(String stageName, boolean critical, Throwable exception, Instant timestamp) {
  public StageFailure {
    stageName = Objects.requireNonNull(stageName, "stageName");
    exception = Objects.requireNonNull(exception, "exception");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  public String message() {
    return String.valueOf(exception.getMessage());
  }
}
