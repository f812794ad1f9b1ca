package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * What happened to one task.
 *
 * @param taskId    task identifier
 * @param status    final status
 * @param error     failure description, {@code null} on success
 * @param duration  wall-clock time spent on the task including retries
 * @param usage     token usage, {@link TokenUsage#NONE} when unknown
 * @param attempts  number of invocation attempts, 0 for tasks never dispatched or served from cache
 * @param fromCache whether the result was restored from the task-result cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskOutcome(
        @JsonProperty("task_id") String taskId,
        TaskStatus status,
        String error,
        @JsonIgnore Duration duration,
        TokenUsage usage,
        int attempts,
        @JsonProperty("from_cache") boolean fromCache
) {

    public TaskOutcome {
        usage = usage != null ? usage : TokenUsage.NONE;
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static TaskOutcome succeeded(String taskId, Duration duration, TokenUsage usage, int attempts) {
        return new TaskOutcome(taskId, TaskStatus.SUCCEEDED, null, duration, usage, attempts, false);
    }

    public static TaskOutcome failed(String taskId, String error, Duration duration, int attempts) {
        return new TaskOutcome(taskId, TaskStatus.FAILED, error, duration, TokenUsage.NONE, attempts, false);
    }

    public static TaskOutcome timedOut(String taskId, String error, Duration duration, int attempts) {
        return new TaskOutcome(taskId, TaskStatus.TIMED_OUT, error, duration, TokenUsage.NONE, attempts, false);
    }

    public static TaskOutcome cached(String taskId, TokenUsage usage) {
        return new TaskOutcome(taskId, TaskStatus.SUCCEEDED, null, Duration.ZERO, usage, 0, true);
    }

    public boolean succeeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    /** Same outcome turned into a failure, keeping timing and attempts. Used when parsing fails. */
    public TaskOutcome asFailure(String reason) {
        return new TaskOutcome(taskId, TaskStatus.FAILED, reason, duration, usage, attempts, fromCache);
    }

    @JsonProperty("duration_seconds")
    public double durationSeconds() {
        return duration.toMillis() / 1000.0;
    }
}
