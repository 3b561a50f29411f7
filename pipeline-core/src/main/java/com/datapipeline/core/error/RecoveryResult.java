package com.datapipeline.core.error;

public record RecoveryResult<T>(boolean success, T result, int attempts) {

  static <T> RecoveryResult<T> recovered(T result, int attempts) {
    return new RecoveryResult<>(true, result, attempts);
  }
}
