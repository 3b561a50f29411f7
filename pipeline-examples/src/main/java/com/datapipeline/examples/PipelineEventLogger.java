package com.datapipeline.examples;

import com.datapipeline.core.event.PipelineEvent;
import com.datapipeline.core.event.PipelineEventBus;
import com.datapipeline.core.event.PipelineEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs every pipeline event, the way an operator console would show them. */
final class PipelineEventLogger {
  private static final Logger log = LoggerFactory.getLogger(PipelineEventLogger.class);

  private PipelineEventLogger() {}

  static PipelineEventBus.Subscription attach(PipelineEventBus bus) {
    PipelineEventBus.Subscription all = bus.subscribeAll(PipelineEventLogger::logEvent);
    PipelineEventBus.Subscription errors = bus.on(PipelineEventType.STAGE_ERROR, PipelineEvent.StageFailed.class,
        e -> log.warn("  {} failed ({}): {}", e.stage(), e.critical() ? "critical" : "non-critical",
            e.error().getMessage()));
    return () -> {
      all.cancel();
      errors.cancel();
    };
  }

  private static void logEvent(PipelineEvent event) {
    if (event instanceof PipelineEvent.StageCompleted c) {
      log.info("[{}] {} in {} ms", event.type().wireName(), c.stage(), c.durationMs());
    } else if (event instanceof PipelineEvent.ParallelGroupStarted p) {
      log.info("[{}] {}", event.type().wireName(), p.stages());
    } else if (event instanceof PipelineEvent.PipelineStarted s) {
      log.info("[{}] {} ({})", event.type().wireName(), s.execution().id(), s.execution().operationType());
    } else {
      log.debug("[{}]", event.type().wireName());
    }
  }
}
