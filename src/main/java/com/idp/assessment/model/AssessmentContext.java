package com.idp.assessment.model;

/**
 * Request payload split at the cache boundary.
 *
 * @param staticSegment   shared, cacheable segment
 * @param dynamicTemplate renders the per-task segment
 */
public record AssessmentContext(
        StaticSegment staticSegment,
        DynamicSegmentTemplate dynamicTemplate
) {

    public DynamicSegment dynamicFor(AssessmentTask task) {
        return dynamicTemplate.render(task);
    }
}
