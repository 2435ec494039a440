package fr.lapetina.weather.aggregator.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Permissive value extraction from provider JSON.
 *
 * Providers disagree on types (wttr.in sends numbers as strings, Meteosource
 * may send humidity as {@code "71%"}), so nothing here throws.
 */
public final class JsonValues {

    private JsonValues() {
        // Utility class
    }

    /**
     * Numeric value, or 0.0 when missing or not a number.
     */
    public static double safeDouble(JsonNode node) {
        Double value = nullableDouble(node);
        return value != null ? value : 0.0;
    }

    /**
     * Numeric value, or null when missing or not a number.
     * Accepts numbers and numeric text, with an optional trailing percent sign.
     */
    public static Double nullableDouble(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual()) {
            return parseDouble(node.asText());
        }
        return null;
    }

    /**
     * Integer code, or null when missing or not a number.
     */
    public static Integer nullableInt(JsonNode node) {
        Double value = nullableDouble(node);
        return value != null ? (int) Math.round(value) : null;
    }

    /**
     * Text value, or "" when missing or not a scalar.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return "";
        }
        return node.asText("").trim();
    }

    /**
     * True when the node is an object or a non-empty array.
     */
    public static boolean isPresent(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return false;
        }
        return node.isObject() || (node.isArray() && !node.isEmpty());
    }

    static Double parseDouble(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.endsWith("%")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
