package com.datapipeline.examples;

import com.datapipeline.examples.services.SimulatedServices;
import com.datapipeline.setup.DataPipeline;
import com.datapipeline.setup.OperationType;
import com.datapipeline.setup.SkippedStage;
import com.datapipeline.setup.collaborator.ChangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** Only images changed, so an incremental run leaves the database and frontend alone. */
public final class Example02IncrementalRun {
  private static final Logger log = LoggerFactory.getLogger(Example02IncrementalRun.class);

  private Example02IncrementalRun() {}

  public static void run() throws Exception {
    ChangeSet changes = ChangeSet.of(List.of("images/new-class.jpg"), List.of(), List.of());
    try (DataPipeline pipeline = DataPipeline.withClasspathSettings(SimulatedServices.healthy(changes))) {
      Map<String, Object> results = pipeline.executePipeline(pipeline.buildPipeline(OperationType.INCREMENTAL, Map.of()));

      results.forEach((stage, result) -> {
        if (result instanceof SkippedStage skipped) {
          log.info("[ex02] {} skipped: {}", stage, skipped.reason());
        } else {
          log.info("[ex02] {} => {}", stage, result);
        }
      });
    }
  }
}
