package com.idp.assessment.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One independently invocable unit of assessment work.
 *
 * @param id              stable identifier, deterministic for identical input
 * @param kind            task kind
 * @param leafPaths       leaves covered by this task, disjoint from every other task of the run
 * @param anchor          path the response is rooted at: the root for simple batches and the
 *                        fallback, the group path for group tasks, the list path for list items
 * @param attributes      schema nodes described to the model for this task
 * @param extractionSlice extraction values sent with the task
 * @param itemStart       first covered list index (inclusive), {@code null} unless {@link TaskKind#LIST_ITEM}
 * @param itemEnd         last covered list index (exclusive), {@code null} unless {@link TaskKind#LIST_ITEM}
 */
public record AssessmentTask(
        String id,
        TaskKind kind,
        List<LeafPath> leafPaths,
        LeafPath anchor,
        List<AttributeNode> attributes,
        JsonNode extractionSlice,
        Integer itemStart,
        Integer itemEnd
) {

    public AssessmentTask {
        leafPaths = List.copyOf(leafPaths);
        attributes = List.copyOf(attributes);
    }

    public int itemCount() {
        return itemStart == null || itemEnd == null ? 0 : itemEnd - itemStart;
    }
}
