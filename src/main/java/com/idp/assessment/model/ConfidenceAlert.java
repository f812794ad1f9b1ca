package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An assessed leaf whose confidence is below its resolved threshold.
 */
public record ConfidenceAlert(
        @JsonProperty("attribute_name") String attributePath,
        double confidence,
        @JsonProperty("confidence_threshold") double threshold
) {
}
