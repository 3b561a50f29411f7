package com.datapipeline.core.event;

public enum PipelineEventType {
  PIPELINE_START("pipeline:start"),
  PIPELINE_COMPLETE("pipeline:complete"),
  PIPELINE_ERROR("pipeline:error"),
  STAGE_START("stage:start"),
  STAGE_COMPLETE("stage:complete"),
  STAGE_ERROR("stage:error"),
  STAGES_PARALLEL_START("stages:parallel:start"),
  STAGES_PARALLEL_COMPLETE("stages:parallel:complete");

  private final String wireName;

  PipelineEventType(String wireName) {
    this.wireName = wireName;
  }

  /** The event name as operators see it in logs, e.g. {@code stage:start}. */
  public String wireName() {
    return wireName;
  }
}
