package com.idp.assessment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.idp.assessment.exception.SchemaMismatchException;
import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.ListAttribute;
import com.idp.assessment.model.SimpleAttribute;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the assessable leaves of an extraction result.
 * <p>
 * Groups are walked depth-first in declaration order; lists are walked over the items actually
 * present in the result. Attributes missing from the result, and {@code null} groups or lists,
 * are treated as pruned and produce no leaves. A {@code null} scalar is still a leaf.
 */
@Service
public class SchemaAnalyzer {

    /**
     * @param schema           root group of the class schema
     * @param extractionResult extraction result to assess
     * @return leaf paths in schema order
     * @throws SchemaMismatchException if the result shape disagrees with the schema
     */
    public List<LeafPath> analyze(GroupAttribute schema, JsonNode extractionResult) {
        if (extractionResult == null || !extractionResult.isObject()) {
            throw new SchemaMismatchException("$", "extraction result must be a JSON object");
        }
        List<LeafPath> leaves = new ArrayList<>();
        walkGroup(schema, extractionResult, LeafPath.ROOT, leaves);
        return leaves;
    }

    private void walk(AttributeNode node, JsonNode value, LeafPath path, List<LeafPath> leaves) {
        if (node instanceof SimpleAttribute) {
            if (value.isContainerNode()) {
                throw new SchemaMismatchException(path.toString(),
                        "simple attribute holds " + (value.isArray() ? "an array" : "an object"));
            }
            leaves.add(path);
        } else if (node instanceof GroupAttribute group) {
            if (value.isNull()) {
                return;
            }
            if (!value.isObject()) {
                throw new SchemaMismatchException(path.toString(), "group attribute is not an object");
            }
            walkGroup(group, value, path, leaves);
        } else if (node instanceof ListAttribute list) {
            if (value.isNull()) {
                return;
            }
            if (!value.isArray()) {
                throw new SchemaMismatchException(path.toString(), "list attribute is not an array");
            }
            for (int i = 0; i < value.size(); i++) {
                walk(list.itemTemplate(), value.get(i), path.child(i), leaves);
            }
        }
    }

    private void walkGroup(GroupAttribute group, JsonNode value, LeafPath path, List<LeafPath> leaves) {
        for (AttributeNode child : group.children()) {
            JsonNode childValue = value.get(child.name());
            if (childValue == null) {
                continue;
            }
            walk(child, childValue, path.child(child.name()), leaves);
        }
    }
}
