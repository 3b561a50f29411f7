package com.datapipeline.core;

public enum StageStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED
}
