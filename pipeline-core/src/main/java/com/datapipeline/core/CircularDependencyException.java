package com.datapipeline.core;

import java.util.List;

public final class CircularDependencyException extends PipelineException {
  private final List<String> unresolved;

  public CircularDependencyException(List<String> unresolved) {
    super("Circular dependency detected in stages: " + String.join(", ", unresolved));
    this.unresolved = List.copyOf(unresolved);
  }

  /** Stages that could not be scheduled, in registration order. */
  public List<String> unresolved() {
    return unresolved;
  }
}
