package com.datapipeline.core;

/** Called after every stage settles, successfully or not. */
@FunctionalInterface
public interface PipelineProgressListener {
  PipelineProgressListener NONE = progress -> { };

  void onProgress(PipelineProgress progress);
}
