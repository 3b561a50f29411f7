package com.datapipeline.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onStageSuccess(String operation, String stage, long nanos) {
        Timer.builder(stageMetric(operation, stage, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onStageError(String operation, String stage, Throwable t) {
        Counter.builder(stageMetric(operation, stage, "errors"))
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onPipelineCompleted(String operation, long nanos) {
        Timer.builder("dp.pipeline." + operation + ".completed")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onPipelineFailed(String operation, String stage) {
        Counter.builder("dp.pipeline." + operation + ".failed")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    @Override
    public void onErrorClassified(String errorType) {
        Counter.builder("dp.errors." + errorType).register(registry).increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String stageMetric(String operation, String stage, String name) {
        return "dp.pipeline." + operation + ".stage." + stage + "." + name;
    }
}
