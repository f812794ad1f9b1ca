package com.idp.assessment.model;

import java.util.List;

/**
 * Object-shaped attribute owning an ordered set of child attributes.
 * The document root is an unnamed group.
 *
 * @param name                property name, empty for the root
 * @param description         description shown to the model
 * @param children            child attributes in declaration order
 * @param confidenceThreshold schema-level threshold inherited by descendants, or {@code null}
 */
public record GroupAttribute(
        String name,
        String description,
        List<AttributeNode> children,
        Double confidenceThreshold
) implements AttributeNode {

    public GroupAttribute {
        name = name != null ? name : "";
        description = description != null ? description : "";
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static GroupAttribute root(List<AttributeNode> children) {
        return new GroupAttribute("", "", children, null);
    }

    public static GroupAttribute of(String name, AttributeNode... children) {
        return new GroupAttribute(name, "", List.of(children), null);
    }

    /** Child with the given name, or {@code null}. */
    public AttributeNode child(String childName) {
        for (AttributeNode child : children) {
            if (child.name().equals(childName)) {
                return child;
            }
        }
        return null;
    }
}
