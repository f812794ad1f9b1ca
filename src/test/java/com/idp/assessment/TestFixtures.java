package com.idp.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.idp.assessment.model.AssessmentSettings;
import com.idp.assessment.model.RetryPolicy;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Shared schema, extraction and response helpers for tests.
 */
public final class TestFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TEMPLATE = """
            Class: {DOCUMENT_CLASS}
            {DOCUMENT_TEXT}
            {ATTRIBUTE_NAMES_AND_DESCRIPTIONS}
            <<CACHEPOINT>>
            {EXTRACTION_RESULTS}""";

    public static final String STATEMENT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "AccountNumber": {"type": "string", "description": "Account number"},
                "StatementDate": {"type": "string", "description": "Statement date"},
                "CustomerName": {"type": "string", "description": "Account holder"},
                "CriticalField": {"type": "string", "description": "Value that must be right"},
                "Bank": {
                  "type": "object",
                  "description": "Issuing bank",
                  "properties": {
                    "Name": {"type": "string", "description": "Bank name"},
                    "Address": {
                      "type": "object",
                      "properties": {
                        "City": {"type": "string"},
                        "Zip": {"type": "string"}
                      }
                    }
                  }
                },
                "Transactions": {
                  "type": "array",
                  "description": "Statement lines",
                  "x-aws-idp-list-item-description": "One statement line",
                  "items": {
                    "type": "object",
                    "properties": {
                      "Date": {"type": "string", "description": "Booking date"},
                      "Amount": {"type": "number", "description": "Signed amount"},
                      "Merchant": {
                        "type": "object",
                        "properties": {"Name": {"type": "string"}}
                      }
                    }
                  }
                }
              }
            }""";

    public static final String STATEMENT_EXTRACTION = """
            {
              "AccountNumber": "1234-5678",
              "StatementDate": "2024-01-31",
              "CustomerName": "Jane Doe",
              "CriticalField": "X-1",
              "Bank": {"Name": "ACME Bank", "Address": {"City": "Springfield", "Zip": "12345"}},
              "Transactions": [
                {"Date": "2024-01-02", "Amount": 10.5, "Merchant": {"Name": "Shop"}},
                {"Date": "2024-01-03", "Amount": -4, "Merchant": {"Name": "Cafe"}}
              ]
            }""";

    /** Order with a list under a root-level group and a list nested inside list items. */
    public static final String ORDER_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "OrderId": {"type": "string"},
                "Customer": {
                  "type": "object",
                  "properties": {
                    "Name": {"type": "string"},
                    "Addresses": {
                      "type": "array",
                      "items": {"type": "object", "properties": {"City": {"type": "string"}}}
                    }
                  }
                },
                "Items": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "Sku": {"type": "string"},
                      "Lines": {
                        "type": "array",
                        "items": {"type": "object", "properties": {"Qty": {"type": "number"}}}
                      }
                    }
                  }
                }
              }
            }""";

    public static final String ORDER_EXTRACTION = """
            {
              "OrderId": "A-1",
              "Customer": {"Name": "Jane Doe", "Addresses": [{"City": "Springfield"}, {"City": "Shelbyville"}]},
              "Items": [
                {"Sku": "S1", "Lines": [{"Qty": 1}]},
                {"Sku": "S2", "Lines": [{"Qty": 3}, {"Qty": 4}]}
              ]
            }""";

    private static final Pattern ITEM_PREFIX = Pattern.compile("(?m)^Item #\\d+: ");

    private TestFixtures() {
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test JSON", e);
        }
    }

    public static AssessmentSettings settings() {
        return new AssessmentSettings(true, true, 3, 1, 4, null, Map.of(), null,
                new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5)), TEMPLATE);
    }

    /**
     * Builds a response that mirrors the extraction values of a dynamic segment rendered from
     * {@link #TEMPLATE}, assessing every value with the given confidence.
     */
    public static String mirrorResponse(String dynamicText, double confidence) {
        String text = dynamicText.trim();
        if (text.startsWith("Item #")) {
            ArrayNode items = MAPPER.createArrayNode();
            for (String item : ITEM_PREFIX.split(text)) {
                if (!item.isBlank()) {
                    items.add(mirror(json(item), confidence));
                }
            }
            return items.toString();
        }
        return mirror(json(text), confidence).toString();
    }

    public static JsonNode mirror(JsonNode value, double confidence) {
        if (value.isObject()) {
            ObjectNode copy = MAPPER.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), mirror(field.getValue(), confidence));
            }
            return copy;
        }
        if (value.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            value.forEach(item -> copy.add(mirror(item, confidence)));
            return copy;
        }
        ObjectNode entry = MAPPER.createObjectNode();
        entry.put("confidence", confidence);
        entry.put("confidence_reason", "matches the document");
        entry.putArray("bbox").add(100).add(200).add(400).add(250);
        entry.put("page", 1);
        return entry;
    }
}
