package com.idp.assessment.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfidenceEntryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void confidenceMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> ConfidenceEntry.of(1.01, null));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceEntry.of(Double.NaN, null));
    }

    @Test
    void boundingBoxMustLieOnThePage() {
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0.9, 0.1, 0.2, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0.1, 0.1, 0.0, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new Geometry(new BoundingBox(0.1, 0.1, 0.1, 0.1), 0));
    }

    /**
     * Leaves serialize as the explainability record, unavailable leaves as an explicit marker.
     */
    @Test
    void treeSerializesLikeTheExtraction() {
        ConfidenceEntry entry = new ConfidenceEntry(0.8, "clear", 0.9,
                List.of(new Geometry(new BoundingBox(0.2, 0.1, 0.3, 0.05), 1)), List.of());
        AssessmentTree.Branch root = new AssessmentTree.Branch(Map.of(
                "Items", new AssessmentTree.Sequence(List.of(
                        new AssessmentTree.Branch(Map.of("Price", new AssessmentTree.Assessed(entry))),
                        new AssessmentTree.Branch(Map.of("Price", new AssessmentTree.Unavailable("list_Items_item_1", "throttled")))))));

        JsonNode json = mapper.valueToTree(new AggregatedAssessment(root));

        JsonNode first = json.path("Items").path(0).path("Price");
        assertThat(first.path("confidence").asDouble()).isEqualTo(0.8);
        assertThat(first.path("confidence_reason").asText()).isEqualTo("clear");
        assertThat(first.path("geometry").path(0).path("boundingBox").path("top").asDouble()).isEqualTo(0.2);
        assertThat(first.path("geometry").path(0).path("page").asInt()).isEqualTo(1);
        assertThat(first.has("geometry_warnings")).isFalse();

        JsonNode second = json.path("Items").path(1).path("Price");
        assertThat(second.path("assessment_unavailable").asBoolean()).isTrue();
        assertThat(second.path("task_id").asText()).isEqualTo("list_Items_item_1");
    }
}
