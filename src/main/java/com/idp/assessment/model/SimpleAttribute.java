package com.idp.assessment.model;

/**
 * Leaf attribute: receives exactly one confidence assessment per occurrence in the result.
 *
 * @param name                property name
 * @param description         description shown to the model
 * @param type                JSON Schema type of the value (string, number, boolean...)
 * @param confidenceThreshold schema-level threshold, or {@code null}
 */
public record SimpleAttribute(
        String name,
        String description,
        String type,
        Double confidenceThreshold
) implements AttributeNode {

    public SimpleAttribute {
        description = description != null ? description : "";
        type = type != null && !type.isBlank() ? type : "string";
    }

    public static SimpleAttribute of(String name) {
        return new SimpleAttribute(name, "", "string", null);
    }
}
