package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Assessment of one leaf value.
 *
 * @param confidence       confidence in [0, 1]
 * @param reason           model explanation, may be {@code null}
 * @param threshold        resolved threshold, {@code null} until aggregation or when none applies
 * @param geometry         evidence locations, possibly empty
 * @param geometryWarnings reasons why reported bounding boxes were rejected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfidenceEntry(
        double confidence,
        @JsonProperty("confidence_reason") String reason,
        @JsonProperty("confidence_threshold") Double threshold,
        List<Geometry> geometry,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("geometry_warnings") List<String> geometryWarnings
) {

    public ConfidenceEntry {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
        }
        geometry = geometry != null ? List.copyOf(geometry) : List.of();
        geometryWarnings = geometryWarnings != null ? List.copyOf(geometryWarnings) : List.of();
    }

    public static ConfidenceEntry of(double confidence, String reason) {
        return new ConfidenceEntry(confidence, reason, null, List.of(), List.of());
    }

    /** Creates a copy carrying the given threshold. */
    public ConfidenceEntry withThreshold(Double newThreshold) {
        return new ConfidenceEntry(confidence, reason, newThreshold, geometry, geometryWarnings);
    }
}
