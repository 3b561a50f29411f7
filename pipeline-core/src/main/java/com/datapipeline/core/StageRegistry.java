package com.datapipeline.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered catalog of known stages and their bodies. Registration order is the stable tie-break used
 * when stages are planned into execution groups.
 */
public final class StageRegistry {
  private final Map<String, RegisteredStage> stages = new LinkedHashMap<>();

  public synchronized StageRegistry register(StageDefinition definition, StageBody body) {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(body, "body");
    if (stages.containsKey(definition.name())) {
      throw new IllegalArgumentException("Stage already registered: " + definition.name());
    }
    stages.put(definition.name(), new RegisteredStage(definition, body, stages.size()));
    return this;
  }

  public synchronized boolean has(String name) {
    return stages.containsKey(name);
  }

  public synchronized StageDefinition definition(String name) {
    return get(name).definition();
  }

  public synchronized StageBody body(String name) {
    return get(name).body();
  }

  public synchronized int order(String name) {
    return get(name).order();
  }

  public synchronized List<StageDefinition> definitions() {
    List<StageDefinition> out = new ArrayList<>(stages.size());
    for (RegisteredStage s : stages.values()) out.add(s.definition());
    return List.copyOf(out);
  }

  public synchronized int size() {
    return stages.size();
  }

  private RegisteredStage get(String name) {
    RegisteredStage stage = stages.get(name);
    if (stage == null) throw new UnknownStageException(name);
    return stage;
  }

  private record RegisteredStage(StageDefinition definition, StageBody body, int order) { }
}
