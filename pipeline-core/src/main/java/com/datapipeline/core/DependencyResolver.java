package com.datapipeline.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Layer-by-layer topological sort of a stage subset into execution groups.
 *
 * <p>Each round collects every remaining stage whose dependencies are all satisfied. That layer is
 * then split, in input order, into groups: consecutive parallel-eligible stages share a group, every
 * other stage is a group of its own. Dependencies on stages outside the subset are ignored.
 */
public final class DependencyResolver {
  private DependencyResolver() {}

  public static List<List<StageDefinition>> resolve(List<StageDefinition> stages) {
    Objects.requireNonNull(stages, "stages");

    Map<String, StageDefinition> remaining = new LinkedHashMap<>();
    for (StageDefinition s : stages) {
      if (remaining.putIfAbsent(s.name(), s) != null) {
        throw new IllegalArgumentException("Duplicate stage in plan: " + s.name());
      }
    }
    Set<String> inPlan = Set.copyOf(remaining.keySet());
    Set<String> satisfied = new HashSet<>();
    List<List<StageDefinition>> plan = new ArrayList<>();

    while (!remaining.isEmpty()) {
      List<StageDefinition> layer = new ArrayList<>();
      for (StageDefinition s : remaining.values()) {
        if (isReady(s, inPlan, satisfied)) layer.add(s);
      }
      if (layer.isEmpty()) {
        throw new CircularDependencyException(List.copyOf(remaining.keySet()));
      }
      plan.addAll(split(layer));
      for (StageDefinition s : layer) {
        satisfied.add(s.name());
        remaining.remove(s.name());
      }
    }
    return List.copyOf(plan);
  }

  private static boolean isReady(StageDefinition stage, Set<String> inPlan, Set<String> satisfied) {
    for (String dep : stage.dependencies()) {
      if (inPlan.contains(dep) && !satisfied.contains(dep)) return false;
    }
    return true;
  }

  private static List<List<StageDefinition>> split(List<StageDefinition> layer) {
    List<List<StageDefinition>> groups = new ArrayList<>();
    List<StageDefinition> parallelRun = new ArrayList<>();
    for (StageDefinition s : layer) {
      if (s.parallel()) {
        parallelRun.add(s);
        continue;
      }
      if (!parallelRun.isEmpty()) {
        groups.add(List.copyOf(parallelRun));
        parallelRun.clear();
      }
      groups.add(List.of(s));
    }
    if (!parallelRun.isEmpty()) groups.add(List.copyOf(parallelRun));
    return groups;
  }
}
