package com.zzf.gazer.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

public final class JsonUtils {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final int MAX_LOGGED_FIELD_LENGTH = 1000;
    private static final String TRUNCATED_SUFFIX = "...[truncated]";
    private static final Set<String> LARGE_FIELDS = Set.of("url", "content", "text", "file_data");

    private JsonUtils() {}

    /**
     * Cuts long payload strings (urls, message text, inline files) in place so request logs stay readable.
     */
    public static void truncateLargeFields(JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isTextual()) {
                    String text = value.asText();
                    if (LARGE_FIELDS.contains(field.getKey()) && text.length() > MAX_LOGGED_FIELD_LENGTH) {
                        field.setValue(object.textNode(text.substring(0, MAX_LOGGED_FIELD_LENGTH) + TRUNCATED_SUFFIX));
                    }
                } else {
                    truncateLargeFields(value);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                truncateLargeFields(item);
            }
        }
    }

    public static String truncateForLog(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
