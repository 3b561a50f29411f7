package com.datapipeline.core.event;

import com.datapipeline.core.ExecutionSnapshot;

import java.util.List;
import java.util.Objects;

/** Lifecycle events published by the engine. Each payload is an immutable record. */
public interface PipelineEvent {
  PipelineEventType type();

  record PipelineStarted(ExecutionSnapshot execution) implements PipelineEvent {
    public PipelineStarted {
      execution = Objects.requireNonNull(execution, "execution");
    }
    @Override public PipelineEventType type() { return PipelineEventType.PIPELINE_START; }
  }

  record PipelineCompleted(ExecutionSnapshot execution) implements PipelineEvent {
    public PipelineCompleted {
      execution = Objects.requireNonNull(execution, "execution");
    }
    @Override public PipelineEventType type() { return PipelineEventType.PIPELINE_COMPLETE; }
  }

  record PipelineFailed(ExecutionSnapshot execution, Throwable error) implements PipelineEvent {
    public PipelineFailed {
      execution = Objects.requireNonNull(execution, "execution");
      error = Objects.requireNonNull(error, "error");
    }
    @Override public PipelineEventType type() { return PipelineEventType.PIPELINE_ERROR; }
  }

  record StageStarted(String stage, String description) implements PipelineEvent {
    public StageStarted {
      stage = Objects.requireNonNull(stage, "stage");
    }
    @Override public PipelineEventType type() { return PipelineEventType.STAGE_START; }
  }

  record StageCompleted(String stage, Object result, long durationMs) implements PipelineEvent {
    public StageCompleted {
      stage = Objects.requireNonNull(stage, "stage");
      result = Objects.requireNonNull(result, "result");
    }
    @Override public PipelineEventType type() { return PipelineEventType.STAGE_COMPLETE; }
  }

  record StageFailed(String stage, Throwable error, boolean critical, long durationMs) implements PipelineEvent {
    public StageFailed {
      stage = Objects.requireNonNull(stage, "stage");
      error = Objects.requireNonNull(error, "error");
    }
    @Override public PipelineEventType type() { return PipelineEventType.STAGE_ERROR; }
  }

  record ParallelGroupStarted(List<String> stages) implements PipelineEvent {
    public ParallelGroupStarted {
      stages = List.copyOf(stages);
    }
    @Override public PipelineEventType type() { return PipelineEventType.STAGES_PARALLEL_START; }
  }

  record ParallelGroupCompleted(List<String> stages) implements PipelineEvent {
    public ParallelGroupCompleted {
      stages = List.copyOf(stages);
    }
    @Override public PipelineEventType type() { return PipelineEventType.STAGES_PARALLEL_COMPLETE; }
  }
}
