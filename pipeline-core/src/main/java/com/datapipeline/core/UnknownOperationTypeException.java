package com.datapipeline.core;

public final class UnknownOperationTypeException extends PipelineException {
  private final String operationType;

  public UnknownOperationTypeException(String operationType) {
    super("Unknown operation type: " + operationType);
    this.operationType = operationType;
  }

  public String operationType() {
    return operationType;
  }
}
