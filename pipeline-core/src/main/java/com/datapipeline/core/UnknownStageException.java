package com.datapipeline.core;

public final class UnknownStageException extends PipelineException {
  private final String stageName;

  public UnknownStageException(String stageName) {
    super("Unknown stage: " + stageName);
    this.stageName = stageName;
  }

  public UnknownStageException(String stageName, String referencedBy) {
    super("Unknown stage: " + stageName + " (referenced by " + referencedBy + ")");
    this.stageName = stageName;
  }

  public String stageName() {
    return stageName;
  }
}
