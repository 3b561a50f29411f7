package com.datapipeline.core;

public final class AlreadyRunningException extends PipelineException {

  public AlreadyRunningException(String runningExecutionId) {
    super("Pipeline is already running (execution " + runningExecutionId + ")");
  }
}
