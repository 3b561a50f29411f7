package com.datapipeline.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-execution counters and stage progress. A fresh instance is installed when an execution starts,
 * so nothing leaks from one run into the next.
 */
final class ExecutionState {
  static final ExecutionState EMPTY = new ExecutionState(List.of());

  private final int total;
  private final Map<String, StageProgress> stages = new LinkedHashMap<>();
  private final List<String> running = new ArrayList<>();
  private int completed;

  ExecutionState(List<StageDefinition> planned) {
    this.total = planned.size();
    for (StageDefinition s : planned) stages.put(s.name(), StageProgress.pending());
  }

  synchronized void markRunning(String stage) {
    stages.put(stage, StageProgress.running());
    running.add(stage);
  }

  synchronized void advance(String stage, int percentage, String message) {
    StageProgress p = stages.get(stage);
    if (p != null && p.status() == StageStatus.RUNNING) stages.put(stage, p.advanced(percentage, message));
  }

  synchronized void markCompleted(String stage, long durationMs) {
    stages.put(stage, StageProgress.completed(durationMs));
    running.remove(stage);
    completed++;
  }

  synchronized void markFailed(String stage, String error, long durationMs) {
    stages.put(stage, StageProgress.failed(error, durationMs));
    running.remove(stage);
  }

  synchronized PipelineProgress progress() {
    return new PipelineProgress(total, completed);
  }

  synchronized List<String> runningStages() {
    return List.copyOf(running);
  }

  synchronized Map<String, StageProgress> stageProgress() {
    return new LinkedHashMap<>(stages);
  }
}
