package com.datapipeline.core.event;

@FunctionalInterface
public interface PipelineEventListener {
  void onEvent(PipelineEvent event);
}
