package com.idp.assessment.model;

import java.util.Map;

/**
 * Thresholds applied at aggregation time.
 *
 * @param globalThreshold        document-level threshold, or {@code null}
 * @param perAttributeThresholds thresholds keyed by leaf path ({@code Items[2].Price}) or schema path ({@code Items.Price})
 */
public record ThresholdConfig(Double globalThreshold, Map<String, Double> perAttributeThresholds) {

    public static final ThresholdConfig NONE = new ThresholdConfig(null, Map.of());

    public ThresholdConfig {
        perAttributeThresholds = perAttributeThresholds != null ? Map.copyOf(perAttributeThresholds) : Map.of();
    }

    /** Configured attribute-level threshold for the path: exact path first, then schema path. */
    public Double attributeThreshold(LeafPath path) {
        Double exact = perAttributeThresholds.get(path.toString());
        return exact != null ? exact : perAttributeThresholds.get(path.schemaPath());
    }
}
