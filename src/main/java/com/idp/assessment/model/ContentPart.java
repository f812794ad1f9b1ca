package com.idp.assessment.model;

/**
 * Piece of the static request segment.
 */
public sealed interface ContentPart permits ContentPart.Text, ContentPart.Image {

    record Text(String text) implements ContentPart {
    }

    record Image(PageImage image) implements ContentPart {
    }
}
