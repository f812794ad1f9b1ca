package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run-level counters returned next to the aggregated assessment.
 * {@code tasksFailed} counts every unsuccessful task, timed-out ones included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunMetadata(
        @JsonProperty("tasks_total") int tasksTotal,
        @JsonProperty("tasks_successful") int tasksSuccessful,
        @JsonProperty("tasks_failed") int tasksFailed,
        @JsonProperty("tasks_timed_out") int tasksTimedOut,
        @JsonProperty("tasks_from_cache") int tasksFromCache,
        @JsonProperty("elapsed_seconds") double elapsedSeconds,
        @JsonProperty("granular_assessment_used") boolean granularUsed,
        @JsonProperty("skipped") boolean skipped,
        @JsonProperty("token_usage") TokenUsage tokenUsage,
        @JsonProperty("error_summary") String errorSummary
) {

    /** Metadata of a run that was skipped because assessment is disabled. */
    public static RunMetadata skippedRun() {
        return new RunMetadata(0, 0, 0, 0, 0, 0.0, false, true, TokenUsage.NONE, null);
    }
}
