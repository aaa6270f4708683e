package com.netbet.bybit.subscription;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/** Lenient field readers for venue payloads, where numbers arrive as strings and may be empty. */
public final class JsonFields {

    private JsonFields() {}

    public static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    /** First non-empty of the given fields, e.g. {@code bid1Price} then {@code bidPrice}. */
    public static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            String s = text(node, f);
            if (s != null) return s;
        }
        return null;
    }

    public static BigDecimal decimal(JsonNode node, String... fields) {
        String s = firstText(node, fields);
        if (s == null) return null;
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static long longValue(JsonNode node, String field, long defaultValue) {
        JsonNode v = node.path(field);
        if (v.isNumber()) return v.asLong();
        String s = text(node, field);
        if (s == null) return defaultValue;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
