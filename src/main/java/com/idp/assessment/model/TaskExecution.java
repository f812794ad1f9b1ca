package com.idp.assessment.model;

/**
 * Scheduler result for one task.
 *
 * @param task     the task
 * @param outcome  how it ended
 * @param response raw response, {@code null} unless the invocation succeeded
 */
public record TaskExecution(AssessmentTask task, TaskOutcome outcome, RawResponse response) {
}
