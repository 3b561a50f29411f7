package com.datapipeline.core.error;

public enum ErrorSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
