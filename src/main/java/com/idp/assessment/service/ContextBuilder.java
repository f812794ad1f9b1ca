package com.idp.assessment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.model.AssessmentContext;
import com.idp.assessment.model.AssessmentSettings;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.ContentPart;
import com.idp.assessment.model.DocumentContext;
import com.idp.assessment.model.DynamicSegment;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.ListAttribute;
import com.idp.assessment.model.PageImage;
import com.idp.assessment.model.StaticSegment;
import com.idp.assessment.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the configured task prompt into the cacheable static segment and a per-task template.
 * <p>
 * Placeholders: {@code {DOCUMENT_TEXT}}, {@code {DOCUMENT_CLASS}}, {@code {OCR_TEXT_CONFIDENCE}},
 * {@code {DOCUMENT_IMAGE}}, {@code {ATTRIBUTE_NAMES_AND_DESCRIPTIONS}} and {@code {EXTRACTION_RESULTS}}.
 * Everything before {@value #CACHE_POINT} is shared by all tasks of the document.
 */
@Service
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    public static final String CACHE_POINT = "<<CACHEPOINT>>";
    static final int MAX_IMAGES = 20;

    private static final String DOCUMENT_TEXT = "{DOCUMENT_TEXT}";
    private static final String DOCUMENT_CLASS = "{DOCUMENT_CLASS}";
    private static final String OCR_TEXT_CONFIDENCE = "{OCR_TEXT_CONFIDENCE}";
    private static final String DOCUMENT_IMAGE = "{DOCUMENT_IMAGE}";
    private static final String ATTRIBUTES = "{ATTRIBUTE_NAMES_AND_DESCRIPTIONS}";
    private static final String EXTRACTION_RESULTS = "{EXTRACTION_RESULTS}";

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{(?:DOCUMENT_TEXT|DOCUMENT_CLASS|OCR_TEXT_CONFIDENCE|ATTRIBUTE_NAMES_AND_DESCRIPTIONS|EXTRACTION_RESULTS)\\}");

    private final ObjectMapper objectMapper;

    public ContextBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validates the task prompt and builds the request context for a document.
     *
     * @throws ConfigurationException if the template is missing or its markers and placeholders are misplaced
     */
    public AssessmentContext build(DocumentContext document, GroupAttribute schema, AssessmentSettings settings) {
        String template = settings.taskPrompt();
        validateTemplate(template);

        int split = template.indexOf(CACHE_POINT);
        String staticTemplate = template.substring(0, split);
        String dynamicTemplate = template.substring(split + CACHE_POINT.length());

        Map<String, String> values = documentValues(document);
        values.put(ATTRIBUTES, describe(schema.children()));
        List<ContentPart> parts = new ArrayList<>();
        int imageAt = staticTemplate.indexOf(DOCUMENT_IMAGE);
        if (imageAt >= 0) {
            addText(parts, substitute(staticTemplate.substring(0, imageAt), values));
            List<PageImage> images = document.pageImages();
            if (images.size() > MAX_IMAGES) {
                log.warn("ContextBuilder: {} page images supplied, only the first {} are attached",
                        images.size(), MAX_IMAGES);
                images = images.subList(0, MAX_IMAGES);
            }
            for (PageImage image : images) {
                parts.add(new ContentPart.Image(image));
            }
            addText(parts, substitute(staticTemplate.substring(imageAt + DOCUMENT_IMAGE.length()), values));
        } else {
            if (!document.pageImages().isEmpty()) {
                log.info("ContextBuilder: template has no {} placeholder, {} page images not attached",
                        DOCUMENT_IMAGE, document.pageImages().size());
            }
            addText(parts, substitute(staticTemplate, values));
        }

        log.debug("ContextBuilder: static segment with {} parts, catalog of {} root attributes",
                parts.size(), schema.children().size());
        Map<String, String> documentValues = documentValues(document);
        return new AssessmentContext(new StaticSegment(parts), task -> {
            Map<String, String> taskValues = new HashMap<>(documentValues);
            taskValues.put(ATTRIBUTES, describe(task.attributes()));
            taskValues.put(EXTRACTION_RESULTS, renderExtraction(task));
            return new DynamicSegment(substitute(dynamicTemplate, taskValues));
        });
    }

    static void validateTemplate(String template) {
        if (template == null || template.isBlank()) {
            throw new ConfigurationException("Assessment task prompt is required but not configured");
        }
        int markers = occurrences(template, CACHE_POINT);
        if (markers != 1) {
            throw new ConfigurationException("Task prompt must contain exactly one " + CACHE_POINT
                    + " marker, found " + markers);
        }
        int split = template.indexOf(CACHE_POINT);
        String before = template.substring(0, split);
        String after = template.substring(split + CACHE_POINT.length());
        if (before.contains(EXTRACTION_RESULTS)) {
            throw new ConfigurationException(EXTRACTION_RESULTS + " must appear after " + CACHE_POINT);
        }
        if (after.contains(DOCUMENT_IMAGE)) {
            throw new ConfigurationException(DOCUMENT_IMAGE + " must appear before " + CACHE_POINT);
        }
        int images = occurrences(before, DOCUMENT_IMAGE);
        if (images > 1) {
            throw new ConfigurationException(DOCUMENT_IMAGE + " may appear at most once, found " + images);
        }
    }

    private static Map<String, String> documentValues(DocumentContext document) {
        Map<String, String> values = new HashMap<>();
        values.put(DOCUMENT_CLASS, document.classLabel());
        values.put(OCR_TEXT_CONFIDENCE, document.ocrTextConfidence());
        values.put(DOCUMENT_TEXT, document.text());
        return values;
    }

    /** Replaces placeholders in one pass; substituted values are never scanned again. */
    static String substitute(String text, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static void addText(List<ContentPart> parts, String text) {
        if (!text.isBlank()) {
            parts.add(new ContentPart.Text(text));
        }
    }

    private static int occurrences(String text, String token) {
        int count = 0;
        for (int at = text.indexOf(token); at >= 0; at = text.indexOf(token, at + token.length())) {
            count++;
        }
        return count;
    }

    /**
     * Renders attribute names and descriptions, one per line:
     * <pre>
     * Account  	[ Account details ]
     *   - Number  	[ Account number ]
     * Items  	[ Line items ]
     *   Each item: One invoice line
     *   - Price  	[ Unit price ]
     * </pre>
     */
    static String describe(List<AttributeNode> attributes) {
        List<String> lines = new ArrayList<>();
        for (AttributeNode attribute : attributes) {
            describe(attribute, 0, lines);
        }
        return String.join("\n", lines);
    }

    private static void describe(AttributeNode node, int depth, List<String> lines) {
        String indent = depth == 0 ? "" : "  ".repeat(depth) + "- ";
        lines.add(indent + node.name() + "  \t[ " + node.description() + " ]");
        if (node instanceof GroupAttribute group) {
            for (AttributeNode child : group.children()) {
                describe(child, depth + 1, lines);
            }
        } else if (node instanceof ListAttribute list) {
            if (!list.itemDescription().isEmpty()) {
                lines.add("  ".repeat(depth + 1) + "Each item: " + list.itemDescription());
            }
            if (list.itemTemplate() instanceof GroupAttribute item) {
                for (AttributeNode child : item.children()) {
                    describe(child, depth + 1, lines);
                }
            }
        }
    }

    private String renderExtraction(AssessmentTask task) {
        if (task.kind() != TaskKind.LIST_ITEM) {
            return pretty(task.extractionSlice());
        }
        List<String> items = new ArrayList<>();
        JsonNode slice = task.extractionSlice();
        for (int i = 0; i < slice.size(); i++) {
            items.add("Item #" + (task.itemStart() + i + 1) + ": " + pretty(slice.get(i)));
        }
        return String.join("\n", items);
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render extraction values", e);
        }
    }
}
