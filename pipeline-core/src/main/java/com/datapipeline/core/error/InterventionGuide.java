package com.datapipeline.core.error;

import java.util.List;
import java.util.Objects;

/** Operator checklist for errors that need a human. */
public record InterventionGuide(ErrorType type, ErrorSeverity severity, List<String> steps) {
  public InterventionGuide {
    type = Objects.requireNonNull(type, "type");
    severity = Objects.requireNonNull(severity, "severity");
    steps = List.copyOf(steps);
  }

  public static InterventionGuide forClassification(ErrorClassification c) {
    return new InterventionGuide(c.type(), c.severity(), stepsFor(c.type()));
  }

  private static List<String> stepsFor(ErrorType type) {
    return switch (type) {
      case SERVICE_UNAVAILABLE -> List.of(
          "Check that the local service containers are running",
          "Restart the unavailable service and wait for its health check",
          "Verify endpoints and network settings in the pipeline configuration");
      case TIMEOUT -> List.of(
          "Check the load on the target service",
          "Rerun the operation once the service responds again");
      case RESOURCE_EXHAUSTION -> List.of(
          "Check free disk space and memory",
          "Clear temporary files and caches",
          "Raise container memory limits or process data in smaller batches");
      case PERMISSION -> List.of(
          "Check file and directory permissions of the working tree",
          "Ensure the current user can write to the project directories",
          "Verify credentials and volume-mount permissions of the containers");
      case DATA_CORRUPTION -> List.of(
          "Inspect the reported file or payload for malformed content",
          "Restore the file from version control or regenerate it");
      case VALIDATION -> List.of(
          "Review the validation report for the failing records",
          "Fix the source data and rerun validation");
      case UNKNOWN -> List.of(
          "Review the error message and stack trace",
          "Check recent changes to code or configuration",
          "Enable debug logging and rerun the operation");
    };
  }
}
