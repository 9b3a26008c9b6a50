package io.marketstream.normalizer.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson setup shared by the normalizers: floats decode as {@link java.math.BigDecimal}
 * and unknown properties are ignored.
 */
public final class JsonSupport {

    private JsonSupport() {
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Returns the text of a field, or null when absent or JSON null.
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
