package com.datapipeline.core;

/** Stage counts for the current (or most recent) execution. */
public record PipelineProgress(int total, int completed) {
  public static final PipelineProgress NONE = new PipelineProgress(0, 0);

  public PipelineProgress {
    if (total < 0 || completed < 0 || completed > total) {
      throw new IllegalArgumentException("invalid progress " + completed + "/" + total);
    }
  }

  public int percentage() {
    return total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
  }
}
