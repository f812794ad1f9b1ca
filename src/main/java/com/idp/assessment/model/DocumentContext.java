package com.idp.assessment.model;

import java.util.List;

/**
 * Document representation the extraction is assessed against.
 *
 * @param documentId        document identifier, used for task-result caching
 * @param sectionId         section identifier, used for task-result caching
 * @param classLabel        document class the section was classified as
 * @param text              parsed document text
 * @param ocrTextConfidence OCR confidence data rendered as text, may be empty
 * @param pageImages        page images in page order
 */
public record DocumentContext(
        String documentId,
        String sectionId,
        String classLabel,
        String text,
        String ocrTextConfidence,
        List<PageImage> pageImages
) {

    public DocumentContext {
        classLabel = classLabel != null ? classLabel : "";
        text = text != null ? text : "";
        ocrTextConfidence = ocrTextConfidence != null ? ocrTextConfidence : "";
        pageImages = pageImages != null ? List.copyOf(pageImages) : List.of();
    }

    public static DocumentContext ofText(String classLabel, String text) {
        return new DocumentContext(null, null, classLabel, text, "", List.of());
    }
}
