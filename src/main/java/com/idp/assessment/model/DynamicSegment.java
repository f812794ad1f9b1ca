package com.idp.assessment.model;

/**
 * Task-specific request text: the attributes to assess and their extracted values.
 */
public record DynamicSegment(String text) {
}
