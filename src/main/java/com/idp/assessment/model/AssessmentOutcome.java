package com.idp.assessment.model;

import java.util.List;

/**
 * Final output of one engine run.
 *
 * @param assessment   explainability tree
 * @param metadata     run-level counters
 * @param alerts       leaves assessed below their threshold
 * @param taskOutcomes per-task outcomes in task order
 */
public record AssessmentOutcome(
        AggregatedAssessment assessment,
        RunMetadata metadata,
        List<ConfidenceAlert> alerts,
        List<TaskOutcome> taskOutcomes
) {

    public AssessmentOutcome {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
        taskOutcomes = taskOutcomes != null ? List.copyOf(taskOutcomes) : List.of();
    }

    public static AssessmentOutcome skipped() {
        return new AssessmentOutcome(AggregatedAssessment.empty(), RunMetadata.skippedRun(), List.of(), List.of());
    }
}
