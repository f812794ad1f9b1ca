package com.idp.assessment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.idp.assessment.exception.ParsingException;
import com.idp.assessment.exception.ResponseValidationException;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.BoundingBox;
import com.idp.assessment.model.ConfidenceEntry;
import com.idp.assessment.model.Geometry;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a model response into per-leaf confidence entries.
 * <p>
 * Model output is parsed leniently:
 * <ul>
 *   <li>JSON is taken from a fenced block or from the first brace/bracket of free text that parses</li>
 *   <li>trailing commas, Java comments, single quotes and unquoted field names are accepted</li>
 *   <li>confidences may be numbers or numeric strings</li>
 * </ul>
 * Bounding boxes come as {@code [x1, y1, x2, y2]} on a 0-1000 scale and are normalized to
 * fractions of the page. Unusable boxes are dropped and reported in {@code geometry_warnings}.
 */
@Service
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final double BBOX_SCALE = 1000.0;

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    /** Lenient mapper for model output. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Parses the response of one task.
     *
     * @return entries for exactly the leaves the task covers, in task order
     * @throws ParsingException            if the response is not JSON or does not cover every leaf
     * @throws ResponseValidationException if a confidence lies outside [0, 1]
     */
    public Map<LeafPath, ConfidenceEntry> parse(AssessmentTask task, RawResponse raw) {
        JsonNode response = readJson(raw == null ? null : raw.text());
        JsonNode anchored = locateAnchor(task, response);

        Map<LeafPath, ConfidenceEntry> entries = new LinkedHashMap<>();
        for (LeafPath leaf : task.leafPaths()) {
            JsonNode node = navigate(task, anchored, leaf);
            if (node == null || !node.isObject() || !node.has("confidence")) {
                throw new ParsingException("Response of task " + task.id() + " has no assessment for " + leaf);
            }
            entries.put(leaf, toEntry(leaf, node));
        }
        log.debug("ResponseParser: task {} -> {} entries", task.id(), entries.size());
        return entries;
    }

    // ── JSON extraction ──────────────────────────────────────────────────────

    /**
     * Reads the first JSON value of the response: the fenced block if there is one, otherwise the
     * value starting at the first brace or bracket that parses. Trailing prose is ignored.
     */
    static JsonNode readJson(String text) {
        if (text == null || text.isBlank()) {
            throw new ParsingException("Empty response text");
        }
        JsonProcessingException firstError = null;
        for (String candidate : candidates(text)) {
            try {
                JsonNode node = LENIENT_MAPPER.readTree(candidate);
                if (node != null && node.isContainerNode()) {
                    return node;
                }
            } catch (JsonProcessingException e) {
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        if (firstError == null) {
            throw new ParsingException("No JSON object found in response");
        }
        throw new ParsingException("Response is not valid JSON: " + firstError.getOriginalMessage(), firstError);
    }

    private static List<String> candidates(String text) {
        List<String> candidates = new ArrayList<>();
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find() && !fenced.group(1).isBlank()) {
            candidates.add(fenced.group(1).trim());
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                candidates.add(text.substring(i));
            }
        }
        return candidates;
    }

    // ── Layout ───────────────────────────────────────────────────────────────

    /** Node that corresponds to the task anchor: the object for groups, the items array for list items. */
    private static JsonNode locateAnchor(AssessmentTask task, JsonNode response) {
        switch (task.kind()) {
            case SIMPLE_BATCH, DOCUMENT -> {
                if (!response.isObject()) {
                    throw new ParsingException("Expected a JSON object for task " + task.id());
                }
                return response;
            }
            case GROUP -> {
                if (!response.isObject()) {
                    throw new ParsingException("Expected a JSON object for task " + task.id());
                }
                JsonNode wrapped = response.get(lastKey(task.anchor()));
                return wrapped != null && wrapped.isObject() && !wrapped.has("confidence") ? wrapped : response;
            }
            case LIST_ITEM -> {
                if (response.isArray()) {
                    return response;
                }
                if (response.isObject()) {
                    JsonNode wrapped = response.get(lastKey(task.anchor()));
                    if (wrapped != null && wrapped.isArray()) {
                        return wrapped;
                    }
                    if (task.itemCount() == 1) {
                        return LENIENT_MAPPER.createArrayNode().add(response);
                    }
                }
                throw new ParsingException("Expected an array of " + task.itemCount() + " items for task " + task.id());
            }
            default -> throw new IllegalStateException("Unknown task kind " + task.kind());
        }
    }

    private static JsonNode navigate(AssessmentTask task, JsonNode anchored, LeafPath leaf) {
        List<LeafPath.Step> steps = leaf.relativeTo(task.anchor());
        JsonNode current = anchored;
        for (int i = 0; i < steps.size() && current != null; i++) {
            LeafPath.Step step = steps.get(i);
            if (step instanceof LeafPath.Key key) {
                current = current.isObject() ? current.get(key.name()) : null;
            } else {
                int index = ((LeafPath.Index) step).value();
                if (i == 0 && task.itemStart() != null) {
                    index -= task.itemStart();
                }
                current = current.isArray() ? current.get(index) : null;
            }
        }
        return current;
    }

    private static String lastKey(LeafPath path) {
        List<LeafPath.Step> steps = path.steps();
        return steps.isEmpty() ? "" : ((LeafPath.Key) steps.get(steps.size() - 1)).name();
    }

    // ── Entries ──────────────────────────────────────────────────────────────

    private static ConfidenceEntry toEntry(LeafPath leaf, JsonNode node) {
        Double confidence = number(node.get("confidence"));
        if (confidence == null) {
            throw new ParsingException("Confidence for " + leaf + " is not a number: " + node.get("confidence"));
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new ResponseValidationException("Confidence for " + leaf + " outside [0, 1]: " + confidence);
        }
        String reason = node.hasNonNull("confidence_reason")
                ? node.get("confidence_reason").asText()
                : node.hasNonNull("reason") ? node.get("reason").asText() : null;

        List<Geometry> geometry = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        readGeometry(leaf, node, geometry, warnings);
        return new ConfidenceEntry(confidence, reason, null, geometry, warnings);
    }

    private static void readGeometry(LeafPath leaf, JsonNode node, List<Geometry> geometry, List<String> warnings) {
        JsonNode bbox = node.get("bbox");
        JsonNode page = node.get("page");
        boolean hasBbox = bbox != null && !bbox.isNull();
        boolean hasPage = page != null && !page.isNull();
        if (!hasBbox && !hasPage) {
            return;
        }
        if (!hasPage) {
            warnings.add("bbox without page");
            log.warn("ResponseParser: bbox without page for {}", leaf);
            return;
        }
        if (!hasBbox) {
            warnings.add("page without bbox");
            log.warn("ResponseParser: page without bbox for {}", leaf);
            return;
        }

        List<JsonNode> boxes = new ArrayList<>();
        if (bbox.isArray() && bbox.size() > 0 && bbox.get(0).isArray()) {
            bbox.forEach(boxes::add);
        } else {
            boxes.add(bbox);
        }
        for (int i = 0; i < boxes.size(); i++) {
            JsonNode pageNode = page.isArray() ? page.get(i) : page;
            String warning = addGeometry(boxes.get(i), pageNode, geometry);
            if (warning != null) {
                warnings.add(warning);
                log.warn("ResponseParser: rejected bounding box for {}: {}", leaf, warning);
            }
        }
    }

    /** Adds the converted box, or returns why it was rejected. */
    static String addGeometry(JsonNode box, JsonNode pageNode, List<Geometry> geometry) {
        if (!box.isArray() || box.size() != 4) {
            return "expected 4 coordinates, got " + box;
        }
        double[] c = new double[4];
        for (int i = 0; i < 4; i++) {
            Double value = number(box.get(i));
            if (value == null) {
                return "non-numeric coordinate in " + box;
            }
            if (value < 0 || value > BBOX_SCALE) {
                return "coordinate outside [0, 1000] in " + box;
            }
            c[i] = value;
        }
        double x1 = c[0], y1 = c[1], x2 = c[2], y2 = c[3];
        if (x2 <= x1 || y2 <= y1) {
            return "degenerate box " + box;
        }
        Double page = number(pageNode);
        if (page == null || page < 1 || page != Math.floor(page)) {
            return "invalid page " + pageNode + " for box " + box;
        }
        geometry.add(new Geometry(
                new BoundingBox(y1 / BBOX_SCALE, x1 / BBOX_SCALE, (x2 - x1) / BBOX_SCALE, (y2 - y1) / BBOX_SCALE),
                page.intValue()));
        return null;
    }

    /** Numeric value of a number or numeric string, otherwise {@code null}. */
    static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                double value = Double.parseDouble(node.asText().trim());
                return Double.isNaN(value) ? null : value;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
