package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of a field's evidence: one bounding box on one 1-based page.
 */
public record Geometry(
        @JsonProperty("boundingBox") BoundingBox boundingBox,
        int page
) {

    public Geometry {
        if (page < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based, got " + page);
        }
    }
}
