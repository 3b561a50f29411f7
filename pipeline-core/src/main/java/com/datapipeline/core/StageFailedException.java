package com.datapipeline.core;

import java.util.Objects;

/**
 * Raised when a critical stage fails and the pipeline is aborted. The cause is the exception the
 * stage body threw, unchanged.
 */
public final class StageFailedException extends PipelineException {
  private final String stageName;
  private final String executionId;

  public StageFailedException(String stageName, String executionId, Throwable cause) {
    super("Critical stage '" + stageName + "' failed: " + Objects.requireNonNull(cause, "cause").getMessage(), cause);
    this.stageName = stageName;
    this.executionId = executionId;
  }

  public String stageName() {
    return stageName;
  }

  public String executionId() {
    return executionId;
  }
}
