package com.idp.assessment.model;

/**
 * Normalized rectangle on a page; every coordinate is a fraction of the page size.
 */
public record BoundingBox(double top, double left, double width, double height) {

    public BoundingBox {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Bounding box must have positive width and height");
        }
        if (top < 0 || left < 0 || top + height > 1.0 + 1e-9 || left + width > 1.0 + 1e-9) {
            throw new IllegalArgumentException("Bounding box must lie within the unit square");
        }
    }
}
