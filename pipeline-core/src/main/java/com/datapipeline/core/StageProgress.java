package com.datapipeline.core;

import java.util.Objects;

public record StageProgress(StageStatus status, int progress, String message, String error, long durationMs) {
  public StageProgress {
    status = Objects.requireNonNull(status, "status");
    if (progress < 0 || progress > 100) throw new IllegalArgumentException("progress must be 0..100");
  }

  static StageProgress pending() {
    return new StageProgress(StageStatus.PENDING, 0, null, null, 0L);
  }

  static StageProgress running() {
    return new StageProgress(StageStatus.RUNNING, 0, null, null, 0L);
  }

  static StageProgress completed(long durationMs) {
    return new StageProgress(StageStatus.COMPLETED, 100, null, null, durationMs);
  }

  static StageProgress failed(String error, long durationMs) {
    return new StageProgress(StageStatus.FAILED, 0, null, error, durationMs);
  }

  StageProgress advanced(int percentage, String msg) {
    return new StageProgress(status, percentage, msg, error, durationMs);
  }
}
