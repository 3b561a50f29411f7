package com.datapipeline.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time engine status. {@code currentStage} is the running stage's name, or the running
 * names joined by ", " while a parallel group is in flight; {@code null} when nothing runs.
 */
public record StatusSnapshot(
    boolean running,
    ExecutionSnapshot currentExecution,
    String currentStage,
    List<String> runningStages,
    PipelineProgress progress,
    Map<String, StageProgress> stageProgress
) {
  public StatusSnapshot {
    runningStages = List.copyOf(Objects.requireNonNull(runningStages, "runningStages"));
    progress = Objects.requireNonNull(progress, "progress");
    stageProgress = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(stageProgress, "stageProgress")));
  }
}
