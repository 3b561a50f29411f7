package com.datapipeline.config;

import com.datapipeline.core.ExecutionHistory;
import com.datapipeline.core.PipelineEngine;
import com.datapipeline.core.StageDefinition;
import com.datapipeline.core.error.ErrorHandler;
import com.datapipeline.core.error.ErrorType;
import com.datapipeline.core.error.RetryPolicy;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
  * Engine tuning read from {@code data-pipeline.json}. Anything not present in the file keeps the
  * value of {@link #defaults()}.
  */
public record PipelineSettings(
        int maxParallelStages,
        long defaultStageTimeoutMs,
        int historyCapacity,
        Map<ErrorType, RetryPolicy> retryPolicies,
        Map<String, StageOverride> stageOverrides
) {
    public PipelineSettings {
        if (maxParallelStages < 1) throw new IllegalArgumentException("maxParallelStages must be >= 1");
        if (defaultStageTimeoutMs < 0) throw new IllegalArgumentException("defaultStageTimeoutMs must be >= 0");
        if (historyCapacity < 0) throw new IllegalArgumentException("historyCapacity must be >= 0");
        Map<ErrorType, RetryPolicy> policies = new EnumMap<>(ErrorType.class);
        policies.putAll(Objects.requireNonNull(retryPolicies, "retryPolicies"));
        retryPolicies = Map.copyOf(policies);
        stageOverrides = Map.copyOf(new LinkedHashMap<>(Objects.requireNonNull(stageOverrides, "stageOverrides")));
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(PipelineEngine.DEFAULT_MAX_PARALLEL_STAGES, PipelineEngine.DEFAULT_STAGE_TIMEOUT_MS,
                ExecutionHistory.UNBOUNDED, RetryPolicy.defaults(), Map.of());
    }

    /** Per-stage override; a {@code null} field leaves the stage's own value alone. */
    public record StageOverride(Long timeoutMs, Boolean critical) {
        public StageOverride {
            if (timeoutMs != null && timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    public StageDefinition applyTo(StageDefinition stage) {
        StageOverride o = stageOverrides.get(stage.name());
        if (o == null) return stage;
        StageDefinition out = stage;
        if (o.timeoutMs() != null) out = out.withTimeoutMs(o.timeoutMs());
        if (o.critical() != null) out = out.withCritical(o.critical());
        return out;
    }

    public ErrorHandler.Builder configure(ErrorHandler.Builder builder) {
        return builder.retryPolicies(retryPolicies);
    }

    public PipelineEngine.Builder configure(PipelineEngine.Builder builder) {
        return builder
                .maxParallelStages(maxParallelStages)
                .defaultStageTimeoutMs(defaultStageTimeoutMs)
                .history(new ExecutionHistory(historyCapacity));
    }
}
