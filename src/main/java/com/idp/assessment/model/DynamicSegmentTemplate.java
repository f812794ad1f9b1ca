package com.idp.assessment.model;

/**
 * Renders the task-specific part of a request.
 */
@FunctionalInterface
public interface DynamicSegmentTemplate {

    DynamicSegment render(AssessmentTask task);
}
