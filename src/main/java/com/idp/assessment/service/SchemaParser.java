package com.idp.assessment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.ListAttribute;
import com.idp.assessment.model.SimpleAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a class definition stored as JSON Schema into an {@link AttributeNode} tree.
 * <p>
 * {@code object} with {@code properties} becomes a group, {@code array} becomes a list,
 * everything else a simple attribute. Local {@code $ref}s to {@code #/$defs} or
 * {@code #/definitions} are inlined.
 */
@Service
public class SchemaParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    static final String CONFIDENCE_THRESHOLD = "x-aws-idp-confidence-threshold";
    static final String LIST_ITEM_DESCRIPTION = "x-aws-idp-list-item-description";

    /**
     * Parses the root schema. The root is an unnamed group.
     *
     * @param schema JSON Schema of the document class
     * @return root group
     * @throws ConfigurationException if the schema is not an object schema or contains a bad reference
     */
    public GroupAttribute parse(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            throw new ConfigurationException("Schema must be a JSON object");
        }
        JsonNode properties = schema.path("properties");
        if (!properties.isObject()) {
            throw new ConfigurationException("Schema root must declare 'properties'");
        }
        List<AttributeNode> children = parseProperties(properties, schema, new HashSet<>());
        log.debug("SchemaParser: parsed {} root attributes", children.size());
        return new GroupAttribute("", schema.path("description").asText(""), children, threshold(schema));
    }

    private List<AttributeNode> parseProperties(JsonNode properties, JsonNode root, Set<String> resolving) {
        List<AttributeNode> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            children.add(parseNode(field.getKey(), field.getValue(), root, resolving));
        }
        return children;
    }

    private AttributeNode parseNode(String name, JsonNode node, JsonNode root, Set<String> resolving) {
        String ref = node.path("$ref").asText(null);
        if (ref != null) {
            if (!resolving.add(ref)) {
                throw new ConfigurationException("Circular schema reference '" + ref + "' at attribute '" + name + "'");
            }
            try {
                AttributeNode resolved = parseNode(name, resolve(ref, root), root, resolving);
                return overlay(resolved, node);
            } finally {
                resolving.remove(ref);
            }
        }

        String type = node.path("type").asText("");
        String description = node.path("description").asText("");
        Double threshold = threshold(node);

        if ("object".equals(type) || (type.isEmpty() && node.has("properties"))) {
            List<AttributeNode> children = parseProperties(node.path("properties"), root, resolving);
            return new GroupAttribute(name, description, children, threshold);
        }
        if ("array".equals(type)) {
            JsonNode items = node.path("items");
            AttributeNode template = items.isObject()
                    ? parseNode("", items, root, resolving)
                    : SimpleAttribute.of("");
            return new ListAttribute(name, description, node.path(LIST_ITEM_DESCRIPTION).asText(""), template, threshold);
        }
        return new SimpleAttribute(name, description, type, threshold);
    }

    private JsonNode resolve(String ref, JsonNode root) {
        String pointer;
        if (ref.startsWith("#/$defs/") || ref.startsWith("#/definitions/")) {
            pointer = ref.substring(1);
        } else {
            throw new ConfigurationException("Unsupported schema reference '" + ref + "'");
        }
        JsonNode target = root.at(pointer);
        if (target.isMissingNode()) {
            throw new ConfigurationException("Unresolvable schema reference '" + ref + "'");
        }
        return target;
    }

    /** Description and threshold written next to a {@code $ref} win over the referenced definition. */
    private AttributeNode overlay(AttributeNode resolved, JsonNode refNode) {
        String description = refNode.has("description") ? refNode.path("description").asText("") : resolved.description();
        Double threshold = refNode.has(CONFIDENCE_THRESHOLD) ? threshold(refNode) : resolved.confidenceThreshold();
        if (resolved instanceof GroupAttribute group) {
            return new GroupAttribute(group.name(), description, group.children(), threshold);
        }
        if (resolved instanceof ListAttribute list) {
            return new ListAttribute(list.name(), description, list.itemDescription(), list.itemTemplate(), threshold);
        }
        SimpleAttribute simple = (SimpleAttribute) resolved;
        return new SimpleAttribute(simple.name(), description, simple.type(), threshold);
    }

    private static Double threshold(JsonNode node) {
        JsonNode value = node.get(CONFIDENCE_THRESHOLD);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            log.warn("SchemaParser: ignoring non-numeric confidence threshold '{}'", text);
            return null;
        }
    }
}
