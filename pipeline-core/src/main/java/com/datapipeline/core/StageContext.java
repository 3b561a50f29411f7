package com.datapipeline.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a stage body sees while it runs: its own name, the operation being executed, the options the
 * pipeline was built with and the results of stages that have already completed.
 */
public final class StageContext {
  private final String stageName;
  private final String operationType;
  private final Map<String, Object> options;
  private final Map<String, Object> completedResults;
  private final StageProgressListener progress;

  public StageContext(String stageName,
                      String operationType,
                      Map<String, Object> options,
                      Map<String, Object> completedResults,
                      StageProgressListener progress) {
    this.stageName = Objects.requireNonNull(stageName, "stageName");
    this.operationType = Objects.requireNonNull(operationType, "operationType");
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(options, "options")));
    this.completedResults = Map.copyOf(Objects.requireNonNull(completedResults, "completedResults"));
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  public String stageName() { return stageName; }
  public String operationType() { return operationType; }
  public Map<String, Object> options() { return options; }
  public StageProgressListener progress() { return progress; }

  public Optional<Object> option(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public boolean flag(String key) {
    Object v = options.get(key);
    if (v instanceof Boolean b) return b;
    return v != null && Boolean.parseBoolean(v.toString());
  }

  /** Result of an upstream stage, typed; empty when the stage did not run or failed. */
  public <T> Optional<T> upstreamResult(String stage, Class<T> type) {
    Object v = completedResults.get(stage);
    return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
  }

  public void reportProgress(int percentage, String message) {
    progress.onProgress(Math.max(0, Math.min(100, percentage)), message);
  }
}
