package com.idp.assessment.model;

import java.util.List;

/**
 * Portion of every request that is identical for all tasks of a document and can be
 * cached by the inference backend. Read-only, shared by all workers.
 */
public record StaticSegment(List<ContentPart> parts) {

    public StaticSegment {
        parts = List.copyOf(parts);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : parts) {
            if (part instanceof ContentPart.Text text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }

    public List<PageImage> images() {
        return parts.stream()
                .filter(ContentPart.Image.class::isInstance)
                .map(part -> ((ContentPart.Image) part).image())
                .toList();
    }
}
