package com.datapipeline.examples;

import com.datapipeline.core.PipelineDefinition;
import com.datapipeline.core.StatusSnapshot;
import com.datapipeline.examples.services.SimulatedServices;
import com.datapipeline.setup.DataPipeline;
import com.datapipeline.setup.OperationType;
import com.datapipeline.setup.collaborator.ChangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public final class Example01FullSetup {
  private static final Logger log = LoggerFactory.getLogger(Example01FullSetup.class);

  private Example01FullSetup() {}

  public static void run() throws Exception {
    ChangeSet changes = ChangeSet.of(List.of("images/studio-1.jpg"), List.of("data/studios.json"), List.of());
    try (DataPipeline pipeline = DataPipeline.withClasspathSettings(SimulatedServices.healthy(changes))) {
      PipelineEventLogger.attach(pipeline.events());

      PipelineDefinition plan = pipeline.buildPipeline(OperationType.FULL_SETUP, Map.of("scenario", "demo", "count", 10));
      log.info("[ex01] {} groups, {} running in parallel, estimated {} ms", plan.executionPlan().size(),
          plan.parallelGroups().isEmpty() ? 0 : plan.parallelGroups().get(0).size(), plan.estimatedDurationMs());

      Map<String, Object> results = pipeline.executePipeline(plan,
          p -> log.info("[ex01] progress {}/{} ({}%)", p.completed(), p.total(), p.percentage()));

      StatusSnapshot status = pipeline.getStatus();
      log.info("[ex01] => {} results, running={}, {}%", results.size(), status.running(), status.progress().percentage());
      log.info("[ex01] seed-database => {}", results.get("seed-database"));
    }
  }
}
