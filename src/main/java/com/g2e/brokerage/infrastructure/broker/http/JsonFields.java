package com.g2e.brokerage.infrastructure.broker.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Lenient readers for vendor JSON. Vendors send numbers both as JSON numbers and as strings.
 */
public final class JsonFields {

    public static BigDecimal decimal(JsonNode node, String field) {
        BigDecimal value = decimalOrNull(node, field);
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal decimalOrNull(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.decimalValue();
        String text = value.asText().trim();
        if (text.isEmpty()) return null;
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static String text(JsonNode node, String field, String defaultValue) {
        String value = text(node, field);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public static long longValue(JsonNode node, String field) {
        BigDecimal value = decimalOrNull(node, field);
        return value == null ? 0L : value.longValue();
    }

    /**
     * Array field as a list. A single object is treated as a one-element list.
     */
    public static List<JsonNode> list(JsonNode node, String field) {
        List<JsonNode> result = new ArrayList<>();
        if (node == null) return result;
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return result;
        if (value.isArray()) {
            value.forEach(result::add);
        } else {
            result.add(value);
        }
        return result;
    }

    public static JsonNode first(JsonNode node, String field) {
        List<JsonNode> items = list(node, field);
        return items.isEmpty() ? null : items.get(0);
    }

    private JsonFields() {}
}
