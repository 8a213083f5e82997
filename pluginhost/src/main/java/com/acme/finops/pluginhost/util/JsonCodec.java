package com.acme.finops.pluginhost.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared JSON codec for manifests, wire envelopes, and reports.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static JsonNode readTree(byte[] raw) throws IOException {
        return MAPPER.readTree(raw);
    }

    public static String writePretty(JsonNode value) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    public static byte[] writeBytes(JsonNode value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
    }

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    public static ArrayNode arrayNode() {
        return MAPPER.createArrayNode();
    }

    public static JsonNode valueToTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static String requiredText(JsonNode root, String field) {
        JsonNode node = root == null ? null : root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("missing required text field: " + field);
        }
        return node.asText().trim();
    }

    public static String optionalText(JsonNode root, String field, String fallback) {
        JsonNode node = root == null ? null : root.get(field);
        return node == null || node.isNull() || !node.isValueNode() ? fallback : node.asText();
    }

    public static double optionalDouble(JsonNode root, String field, double fallback) {
        JsonNode node = root == null ? null : root.get(field);
        return node == null || !node.isNumber() ? fallback : node.asDouble();
    }

    public static long optionalLong(JsonNode root, String field, long fallback) {
        JsonNode node = root == null ? null : root.get(field);
        return node == null || !node.isNumber() ? fallback : node.asLong();
    }

    public static boolean optionalBoolean(JsonNode root, String field, boolean fallback) {
        JsonNode node = root == null ? null : root.get(field);
        return node == null || !node.isBoolean() ? fallback : node.asBoolean();
    }

    public static List<String> textList(JsonNode root, String field) {
        JsonNode node = root == null ? null : root.get(field);
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                out.add(item.asText().trim());
            }
        }
        return out;
    }

    public static Map<String, String> stringMap(JsonNode root, String field) {
        JsonNode node = root == null ? null : root.get(field);
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        node.fields().forEachRemaining(e -> {
            if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                out.put(e.getKey(), e.getValue().asText());
            }
        });
        return out;
    }
}
