package com.idp.assessment.model;

/**
 * Array-shaped attribute. Every item of the extracted array has the shape of {@code itemTemplate};
 * the number of items is only known from the extraction result.
 *
 * @param name                property name
 * @param description         description shown to the model
 * @param itemDescription     description of a single item, may be empty
 * @param itemTemplate        shape of each item
 * @param confidenceThreshold schema-level threshold inherited by item attributes, or {@code null}
 */
public record ListAttribute(
        String name,
        String description,
        String itemDescription,
        AttributeNode itemTemplate,
        Double confidenceThreshold
) implements AttributeNode {

    public ListAttribute {
        description = description != null ? description : "";
        itemDescription = itemDescription != null ? itemDescription : "";
        if (itemTemplate == null) {
            itemTemplate = SimpleAttribute.of("");
        }
    }

    public static ListAttribute of(String name, AttributeNode itemTemplate) {
        return new ListAttribute(name, "", "", itemTemplate, null);
    }
}
