package com.idp.assessment.model;

import java.time.Duration;
import java.util.Map;

/**
 * Effective configuration of one engine run.
 *
 * @param enabled                when {@code false} the run is a no-op
 * @param granular               when {@code false} a single task covers the whole extraction
 * @param simpleBatchSize        root-level simple attributes per task
 * @param listBatchSize          consecutive list items per task
 * @param maxWorkers             maximum concurrent invocations
 * @param globalThreshold        document-level confidence threshold, or {@code null}
 * @param perAttributeThresholds attribute-level thresholds
 * @param deadline               run deadline after which nothing new is dispatched, or {@code null}
 * @param retry                  backoff policy for throttled calls
 * @param taskPrompt             task prompt template containing exactly one cache-split marker
 */
public record AssessmentSettings(
        boolean enabled,
        boolean granular,
        int simpleBatchSize,
        int listBatchSize,
        int maxWorkers,
        Double globalThreshold,
        Map<String, Double> perAttributeThresholds,
        Duration deadline,
        RetryPolicy retry,
        String taskPrompt
) {

    public AssessmentSettings {
        perAttributeThresholds = perAttributeThresholds != null ? Map.copyOf(perAttributeThresholds) : Map.of();
        retry = retry != null ? retry : RetryPolicy.DEFAULT;
    }

    public ThresholdConfig thresholds() {
        return new ThresholdConfig(globalThreshold, perAttributeThresholds);
    }

    /**
     * Per-request overrides; {@code null} fields keep the configured value.
     */
    public record Overrides(
            Boolean enabled,
            Boolean granular,
            Integer simpleBatchSize,
            Integer listBatchSize,
            Integer maxWorkers,
            Double globalThreshold,
            Map<String, Double> perAttributeThresholds,
            Duration deadline
    ) {
    }

    public AssessmentSettings merge(Overrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new AssessmentSettings(
                overrides.enabled() != null ? overrides.enabled() : enabled,
                overrides.granular() != null ? overrides.granular() : granular,
                overrides.simpleBatchSize() != null ? overrides.simpleBatchSize() : simpleBatchSize,
                overrides.listBatchSize() != null ? overrides.listBatchSize() : listBatchSize,
                overrides.maxWorkers() != null ? overrides.maxWorkers() : maxWorkers,
                overrides.globalThreshold() != null ? overrides.globalThreshold() : globalThreshold,
                overrides.perAttributeThresholds() != null ? overrides.perAttributeThresholds() : perAttributeThresholds,
                overrides.deadline() != null ? overrides.deadline() : deadline,
                retry,
                taskPrompt
        );
    }

    public AssessmentSettings withEnabled(boolean value) {
        return new AssessmentSettings(value, granular, simpleBatchSize, listBatchSize, maxWorkers,
                globalThreshold, perAttributeThresholds, deadline, retry, taskPrompt);
    }

    public AssessmentSettings withGranular(boolean value) {
        return new AssessmentSettings(enabled, value, simpleBatchSize, listBatchSize, maxWorkers,
                globalThreshold, perAttributeThresholds, deadline, retry, taskPrompt);
    }

    public AssessmentSettings withBatchSizes(int simple, int list) {
        return new AssessmentSettings(enabled, granular, simple, list, maxWorkers,
                globalThreshold, perAttributeThresholds, deadline, retry, taskPrompt);
    }

    public AssessmentSettings withMaxWorkers(int value) {
        return new AssessmentSettings(enabled, granular, simpleBatchSize, listBatchSize, value,
                globalThreshold, perAttributeThresholds, deadline, retry, taskPrompt);
    }

    public AssessmentSettings withThresholds(Double global, Map<String, Double> perAttribute) {
        return new AssessmentSettings(enabled, granular, simpleBatchSize, listBatchSize, maxWorkers,
                global, perAttribute, deadline, retry, taskPrompt);
    }

    public AssessmentSettings withDeadline(Duration value) {
        return new AssessmentSettings(enabled, granular, simpleBatchSize, listBatchSize, maxWorkers,
                globalThreshold, perAttributeThresholds, value, retry, taskPrompt);
    }

    public AssessmentSettings withRetry(RetryPolicy value) {
        return new AssessmentSettings(enabled, granular, simpleBatchSize, listBatchSize, maxWorkers,
                globalThreshold, perAttributeThresholds, deadline, value, taskPrompt);
    }

    public AssessmentSettings withTaskPrompt(String value) {
        return new AssessmentSettings(enabled, granular, simpleBatchSize, listBatchSize, maxWorkers,
                globalThreshold, perAttributeThresholds, deadline, retry, value);
    }
}
