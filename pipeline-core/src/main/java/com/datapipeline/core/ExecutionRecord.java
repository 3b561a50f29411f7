package com.datapipeline.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** The run in progress. Mutated by the engine only; everything else sees {@link #snapshot()}. */
final class ExecutionRecord {
  private final String id;
  private final PipelineDefinition pipeline;
  private final Instant startedAt;
  private final Map<String, Object> results = new LinkedHashMap<>();
  private final List<StageFailure> failures = new ArrayList<>();
  private ExecutionStatus status = ExecutionStatus.RUNNING;
  private Instant endedAt;
  private Throwable error;

  ExecutionRecord(String id, PipelineDefinition pipeline, Instant startedAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
  }

  String id() { return id; }

  synchronized void putResult(String stage, Object result) {
    results.put(stage, Objects.requireNonNull(result, "result"));
  }

  synchronized void addFailure(StageFailure failure) {
    failures.add(Objects.requireNonNull(failure, "failure"));
  }

  synchronized Map<String, Object> results() {
    return new LinkedHashMap<>(results);
  }

  synchronized void complete(Instant at) {
    status = ExecutionStatus.COMPLETED;
    endedAt = at;
  }

  synchronized void fail(Throwable cause, Instant at) {
    status = ExecutionStatus.FAILED;
    error = cause;
    endedAt = at;
  }

  synchronized ExecutionSnapshot snapshot() {
    return new ExecutionSnapshot(id, pipeline, status, results, failures, startedAt, endedAt, error);
  }
}
