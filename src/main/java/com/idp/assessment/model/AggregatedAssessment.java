package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Explainability structure for one extraction result: a tree isomorphic to the result
 * with every leaf replaced by its assessment.
 */
public record AggregatedAssessment(AssessmentTree.Branch root) {

    public static AggregatedAssessment empty() {
        return new AggregatedAssessment(new AssessmentTree.Branch(Map.of()));
    }

    public boolean isEmpty() {
        return root.children().isEmpty();
    }

    /** Node at the given path, or {@code null} when the path does not exist. */
    public AssessmentTree at(LeafPath path) {
        AssessmentTree current = root;
        for (LeafPath.Step step : path.steps()) {
            if (step instanceof LeafPath.Key key && current instanceof AssessmentTree.Branch branch) {
                current = branch.get(key.name());
            } else if (step instanceof LeafPath.Index index && current instanceof AssessmentTree.Sequence sequence
                    && index.value() < sequence.items().size()) {
                current = sequence.get(index.value());
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /** Assessment at the given path, or {@code null} when it is missing or unavailable. */
    public ConfidenceEntry entryAt(LeafPath path) {
        return at(path) instanceof AssessmentTree.Assessed assessed ? assessed.entry() : null;
    }

    @JsonValue
    public AssessmentTree.Branch json() {
        return root;
    }
}
