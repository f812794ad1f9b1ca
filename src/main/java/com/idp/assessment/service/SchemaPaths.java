package com.idp.assessment.service;

import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.ListAttribute;

import java.util.ArrayList;
import java.util.List;

/**
 * Navigation helpers between leaf paths and schema nodes.
 */
final class SchemaPaths {

    private SchemaPaths() {
    }

    /**
     * Schema nodes visited along {@code path}, starting with the root. Index steps map to the
     * item template of the enclosing list. Stops early when the path leaves the schema.
     */
    static List<AttributeNode> lineage(GroupAttribute root, LeafPath path) {
        List<AttributeNode> nodes = new ArrayList<>(path.depth() + 1);
        AttributeNode current = root;
        nodes.add(current);
        for (LeafPath.Step step : path.steps()) {
            AttributeNode next = null;
            if (step instanceof LeafPath.Key key && current instanceof GroupAttribute group) {
                next = group.child(key.name());
            } else if (step instanceof LeafPath.Index && current instanceof ListAttribute list) {
                next = list.itemTemplate();
            }
            if (next == null) {
                break;
            }
            nodes.add(next);
            current = next;
        }
        return nodes;
    }

    /** Position of the first index step, or -1 when the path does not cross a list. */
    static int firstIndexStep(LeafPath path) {
        List<LeafPath.Step> steps = path.steps();
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) instanceof LeafPath.Index) {
                return i;
            }
        }
        return -1;
    }

    /** Copy of {@code group} without list descendants; {@code null} when nothing assessable remains. */
    static GroupAttribute withoutLists(GroupAttribute group) {
        List<AttributeNode> kept = new ArrayList<>();
        for (AttributeNode child : group.children()) {
            if (child instanceof ListAttribute) {
                continue;
            }
            if (child instanceof GroupAttribute nested) {
                GroupAttribute stripped = withoutLists(nested);
                if (stripped != null) {
                    kept.add(stripped);
                }
            } else {
                kept.add(child);
            }
        }
        if (kept.isEmpty()) {
            return null;
        }
        return new GroupAttribute(group.name(), group.description(), kept, group.confidenceThreshold());
    }
}
