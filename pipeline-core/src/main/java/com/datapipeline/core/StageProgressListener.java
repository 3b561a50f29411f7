package com.datapipeline.core;

/** Stage-level progress sink handed to stage bodies and, through them, to collaborators. */
@FunctionalInterface
public interface StageProgressListener {
  StageProgressListener NONE = (percentage, message) -> { };

  void onProgress(int percentage, String message);
}
