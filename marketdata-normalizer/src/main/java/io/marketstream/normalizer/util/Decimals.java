package io.marketstream.normalizer.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Exact decimal parsing of wire values. Floating point is never involved.
 */
public final class Decimals {

    private Decimals() {
    }

    /**
     * Parses a textual or numeric JSON value.
     *
     * @return the decimal value, or null if the node is missing, null or blank
     * @throws NumberFormatException if the text is not a number
     */
    public static BigDecimal parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return parse(node.asText());
    }

    /**
     * Parses decimal text.
     *
     * @return the decimal value, or null for null or blank text
     * @throws NumberFormatException if the text is not a number
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return new BigDecimal(text.trim());
    }

    /**
     * Like {@link #parse(JsonNode)} but rejects absent values.
     */
    public static BigDecimal require(JsonNode node, String field) {
        BigDecimal value = parse(node);
        if (value == null) {
            throw new IllegalArgumentException("missing numeric field: " + field);
        }
        return value;
    }
}
