package com.datapipeline.core.error;

public enum ErrorType {
  SERVICE_UNAVAILABLE,
  TIMEOUT,
  RESOURCE_EXHAUSTION,
  PERMISSION,
  DATA_CORRUPTION,
  VALIDATION,
  UNKNOWN
}
