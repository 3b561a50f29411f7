package com.datapipeline.setup;

import com.datapipeline.config.PipelineSettings;
import com.datapipeline.config.PipelineSettingsLoader;
import com.datapipeline.core.ExecutionSnapshot;
import com.datapipeline.core.PipelineDefinition;
import com.datapipeline.core.PipelineEngine;
import com.datapipeline.core.PipelineProgressListener;
import com.datapipeline.core.StageDefinition;
import com.datapipeline.core.StatusSnapshot;
import com.datapipeline.core.error.ErrorHandler;
import com.datapipeline.core.event.PipelineEventBus;
import com.datapipeline.metrics.MetricsRecorder;
import com.datapipeline.metrics.SimpleMetricsRecorder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for local environment setup: plans and runs {@link OperationType}s over the
 * {@link SetupStage}s against the given collaborators.
 *
 * <pre>{@code
 * try (DataPipeline pipeline = new DataPipeline(collaborators)) {
 *   PipelineDefinition plan = pipeline.buildPipeline(OperationType.IMAGES_ONLY, Map.of());
 *   Map<String, Object> results = pipeline.executePipeline(plan, p -> log.info("{}%", p.percentage()));
 * }
 * }</pre>
 */
public final class DataPipeline implements AutoCloseable {
  private final PipelineEngine engine;

  public DataPipeline(SetupCollaborators collaborators) {
    this(collaborators, PipelineSettings.defaults());
  }

  public DataPipeline(SetupCollaborators collaborators, PipelineSettings settings) {
    this(collaborators, settings, new SimpleMetricsRecorder());
  }

  public DataPipeline(SetupCollaborators collaborators, PipelineSettings settings, MetricsRecorder metrics) {
    this(new SetupStageBodies(collaborators), settings, metrics);
  }

  DataPipeline(SetupStageBodies bodies, PipelineSettings settings, MetricsRecorder metrics) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(metrics, "metrics");
    ErrorHandler errorHandler = settings.configure(ErrorHandler.builder().metrics(metrics)).build();
    this.engine = settings.configure(PipelineEngine.builder())
        .registry(bodies.registry(settings))
        .catalog(OperationType.catalog())
        .errorHandler(errorHandler)
        .metrics(metrics)
        .build();
  }

  /** Uses the settings in {@code data-pipeline.json} on the classpath, if there is one. */
  public static DataPipeline withClasspathSettings(SetupCollaborators collaborators) throws IOException {
    return new DataPipeline(collaborators, PipelineSettingsLoader.loadDefault());
  }

  public PipelineDefinition buildPipeline(OperationType operationType, Map<String, Object> options) {
    return buildPipeline(Objects.requireNonNull(operationType, "operationType").id(), options);
  }

  /** @throws com.datapipeline.core.UnknownOperationTypeException for an id not in {@link #getOperationTypes()} */
  public PipelineDefinition buildPipeline(String operationType, Map<String, Object> options) {
    return engine.buildPipeline(operationType, options);
  }

  public Map<String, Object> executePipeline(PipelineDefinition pipeline) {
    return engine.executePipeline(pipeline);
  }

  public Map<String, Object> executePipeline(PipelineDefinition pipeline, PipelineProgressListener listener) {
    return engine.executePipeline(pipeline, listener);
  }

  public StatusSnapshot getStatus() {
    return engine.getStatus();
  }

  public boolean isRunning() {
    return engine.isRunning();
  }

  public List<ExecutionSnapshot> getExecutionHistory() {
    return engine.getExecutionHistory();
  }

  public PipelineEventBus events() {
    return engine.events();
  }

  public ErrorHandler errorHandler() {
    return engine.errorHandler();
  }

  public MetricsRecorder metrics() {
    return engine.metrics();
  }

  @Override
  public void close() {
    engine.close();
  }

  /** Every setup stage with its default metadata, in registration order. */
  public static List<StageDefinition> getAvailableStages() {
    List<StageDefinition> out = new ArrayList<>();
    for (SetupStage s : SetupStage.values()) out.add(s.definition());
    return out;
  }

  public static List<String> getOperationTypes() {
    return OperationType.ids();
  }
}
