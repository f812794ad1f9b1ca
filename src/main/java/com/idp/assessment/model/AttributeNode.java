package com.idp.assessment.model;

/**
 * Node of an attribute schema. The three permitted shapes mirror the shapes an extraction
 * result can take: scalars, objects and arrays.
 */
public sealed interface AttributeNode permits SimpleAttribute, GroupAttribute, ListAttribute {

    /** Property name; empty for the document root. */
    String name();

    /** Human-readable description shown to the model, may be empty. */
    String description();

    /** Threshold declared on the schema itself, or {@code null}. */
    Double confidenceThreshold();
}
