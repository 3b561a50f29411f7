package com.datapipeline.core;

/** Base type for failures raised by the pipeline engine itself. */
public class PipelineException extends RuntimeException {

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
