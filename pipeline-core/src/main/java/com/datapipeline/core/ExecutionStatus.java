package com.datapipeline.core;

public enum ExecutionStatus {
  RUNNING,
  COMPLETED,
  FAILED
}
