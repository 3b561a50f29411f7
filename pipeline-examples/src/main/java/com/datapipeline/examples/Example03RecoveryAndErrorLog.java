package com.datapipeline.examples;

import com.datapipeline.config.ErrorLogExporter;
import com.datapipeline.core.StageFailure;
import com.datapipeline.core.error.ErrorContext;
import com.datapipeline.core.error.ErrorHandler;
import com.datapipeline.core.error.ErrorStats;
import com.datapipeline.core.error.RecoveryResult;
import com.datapipeline.examples.services.SimulatedServices;
import com.datapipeline.setup.DataPipeline;
import com.datapipeline.setup.OperationType;
import com.datapipeline.setup.SetupCollaborators;
import com.datapipeline.setup.collaborator.ChangeSet;
import com.datapipeline.setup.collaborator.CollaboratorRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The image service refuses connections at first. The pipeline still completes because image
 * processing is non-critical; the failed upload is then retried through the error handler and the
 * error log is exported as JSON.
 */
public final class Example03RecoveryAndErrorLog {
  private static final Logger log = LoggerFactory.getLogger(Example03RecoveryAndErrorLog.class);

  private Example03RecoveryAndErrorLog() {}

  public static void run() throws Exception {
    ChangeSet changes = ChangeSet.of(List.of("images/a.jpg", "images/b.jpg"), List.of("data/classes.json"), List.of());
    SetupCollaborators services = SimulatedServices.flakyImages(changes, 2);

    try (DataPipeline pipeline = DataPipeline.withClasspathSettings(services)) {
      PipelineEventLogger.attach(pipeline.events());
      Map<String, Object> results = pipeline.executePipeline(pipeline.buildPipeline(OperationType.FULL_SETUP, Map.of()));
      log.info("[ex03] completed without process-images: {}", !results.containsKey("process-images"));

      ErrorHandler errors = pipeline.errorHandler();
      for (StageFailure failure : pipeline.getExecutionHistory().get(0).failures()) {
        if (!(failure.exception() instanceof Exception cause)) continue;
        ErrorContext<Object> ctx = ErrorContext.builder()
            .stage(failure.stageName())
            .operation(() -> services.imageProcessor().processImages(CollaboratorRequest.of(Map.of())))
            .build();
        RecoveryResult<Object> recovered = errors.handleError(cause, ctx);
        log.info("[ex03] {} recovered after {} attempt(s): {}", failure.stageName(), recovered.attempts(),
            recovered.result());
      }

      ErrorStats stats = errors.getStats();
      log.info("[ex03] errors={}, recovered={}, failed={}", stats.totalErrors(), stats.successfulRecoveries(),
          stats.failedRecoveries());

      Path out = Path.of("target", "error-log.json");
      new ErrorLogExporter().export(errors, out);
      log.info("[ex03] error log written to {}", out.toAbsolutePath());
    }
  }
}
