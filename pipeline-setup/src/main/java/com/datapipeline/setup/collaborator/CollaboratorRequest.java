package com.datapipeline.setup.collaborator;

import com.datapipeline.core.StageProgressListener;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a processing collaborator gets from its stage: the pipeline options (scenario, count, ...)
 * and a sink for 0..100 progress updates.
 */
public record CollaboratorRequest(Map<String, Object> options, StageProgressListener onProgress) {
  public CollaboratorRequest {
    options = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(options, "options")));
    onProgress = onProgress == null ? StageProgressListener.NONE : onProgress;
  }

  public static CollaboratorRequest of(Map<String, Object> options) {
    return new CollaboratorRequest(options, StageProgressListener.NONE);
  }

  public void reportProgress(int percentage, String message) {
    onProgress.onProgress(percentage, message);
  }
}
