package com.datapipeline.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Frozen view of an {@link ExecutionRecord}; this is what events, status and history expose. */
public record ExecutionSnapshot(
    String id,
    PipelineDefinition pipeline,
    ExecutionStatus status,
    Map<String, Object> results,
    List<StageFailure> failures,
    Instant startedAt,
    Instant endedAt,
    Throwable error
) {
  public ExecutionSnapshot {
    id = Objects.requireNonNull(id, "id");
    pipeline = Objects.requireNonNull(pipeline, "pipeline");
    status = Objects.requireNonNull(status, "status");
    results = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(results, "results")));
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    startedAt = Objects.requireNonNull(startedAt, "startedAt");
  }

  public String operationType() {
    return pipeline.operationType();
  }

  public Optional<Duration> duration() {
    return endedAt == null ? Optional.empty() : Optional.of(Duration.between(startedAt, endedAt));
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
