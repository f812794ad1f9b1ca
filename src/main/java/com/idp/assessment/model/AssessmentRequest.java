package com.idp.assessment.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Body of {@code POST /api/assess}.
 *
 * @param documentId document identifier, enables the task-result cache together with {@code sectionId}
 * @param sectionId  section identifier
 * @param document   document representation
 * @param schema     JSON Schema of the document class
 * @param extraction extraction result to assess
 * @param settings   per-request overrides, may be {@code null}
 */
public record AssessmentRequest(
        String documentId,
        String sectionId,
        Document document,
        JsonNode schema,
        JsonNode extraction,
        AssessmentSettings.Overrides settings
) {

    /**
     * @param pageImages page images; {@code data} is base64 in JSON
     */
    public record Document(String text, String classLabel, String ocrTextConfidence, List<PageImage> pageImages) {}

    public DocumentContext toDocumentContext() {
        Document doc = document != null ? document : new Document(null, null, null, null);
        return new DocumentContext(documentId, sectionId, doc.classLabel(), doc.text(),
                doc.ocrTextConfidence(), doc.pageImages());
    }
}
