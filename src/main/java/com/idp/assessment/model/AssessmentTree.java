package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of the explainability tree. Objects and arrays mirror the extraction result;
 * leaves are either an assessment or an explicit unavailability marker, and {@code null}
 * groups, lists or list items of the result stay {@code null}.
 */
public sealed interface AssessmentTree permits AssessmentTree.Branch, AssessmentTree.Sequence,
        AssessmentTree.Assessed, AssessmentTree.Unavailable, AssessmentTree.Empty {

    record Branch(Map<String, AssessmentTree> children) implements AssessmentTree {
        public Branch {
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }

        @JsonValue
        public Map<String, AssessmentTree> json() {
            return children;
        }

        public AssessmentTree get(String key) {
            return children.get(key);
        }
    }

    record Sequence(List<AssessmentTree> items) implements AssessmentTree {
        public Sequence {
            items = List.copyOf(items);
        }

        @JsonValue
        public List<AssessmentTree> json() {
            return items;
        }

        public AssessmentTree get(int index) {
            return items.get(index);
        }
    }

    record Assessed(ConfidenceEntry entry) implements AssessmentTree {
        @JsonValue
        public ConfidenceEntry json() {
            return entry;
        }
    }

    /** Leaf whose owning task did not succeed; distinct from a low-confidence assessment. */
    @JsonPropertyOrder({"assessment_unavailable", "task_id", "reason"})
    record Unavailable(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("reason") String reason
    ) implements AssessmentTree {
        @JsonProperty("assessment_unavailable")
        public boolean marker() {
            return true;
        }
    }

    /** {@code null} container in the extraction result; serializes as JSON {@code null}. */
    record Empty() implements AssessmentTree {
        public static final Empty INSTANCE = new Empty();

        @JsonValue
        public Object json() {
            return null;
        }
    }
}
