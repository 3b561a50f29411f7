package com.datapipeline.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A built, immutable plan for one operation. */
public record PipelineDefinition(
    String operationType,
    List<StageDefinition> stages,
    List<List<StageDefinition>> executionPlan,
    Map<String, Object> options,
    long estimatedDurationMs
) {
  public PipelineDefinition {
    operationType = Objects.requireNonNull(operationType, "operationType");
    stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
    List<List<StageDefinition>> groups = new ArrayList<>();
    for (List<StageDefinition> g : Objects.requireNonNull(executionPlan, "executionPlan")) {
      if (g.isEmpty()) throw new IllegalArgumentException("execution group must not be empty");
      groups.add(List.copyOf(g));
    }
    executionPlan = List.copyOf(groups);
    // options may hold nulls, which Map.copyOf rejects
    options = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(options, "options")));
    if (estimatedDurationMs < 0) throw new IllegalArgumentException("estimatedDurationMs must be >= 0");
  }

  public List<String> stageNames() {
    List<String> names = new ArrayList<>(stages.size());
    for (StageDefinition s : stages) names.add(s.name());
    return names;
  }

  /** Groups with more than one stage, i.e. those that run concurrently. */
  public List<List<StageDefinition>> parallelGroups() {
    List<List<StageDefinition>> out = new ArrayList<>();
    for (List<StageDefinition> g : executionPlan) {
      if (g.size() > 1) out.add(g);
    }
    return out;
  }
}
