package com.datapipeline.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onStageSuccess(String operation, String stage, long nanos);
    void onStageError(String operation, String stage, Throwable t);
    void onPipelineCompleted(String operation, long nanos);
    void onPipelineFailed(String operation, String stage);
    void onErrorClassified(String errorType);
    MeterRegistry registry();
}
