package com.acme.werp.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Comparator;

public final class JsonSupport {
    private JsonSupport() {}

    private static final double NUMERIC_EPS = 1e-9;

    /** Treats 3 and 3.0 as equal, since stored documents mix int and double encodings. */
    private static final Comparator<JsonNode> NUMERIC_TOLERANT = (a, b) -> {
        if (a.isNumber() && b.isNumber()) return Math.abs(a.asDouble() - b.asDouble()) <= NUMERIC_EPS ? 0 : 1;
        return a.equals(b) ? 0 : 1;
    };

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static boolean sameTree(JsonNode a, JsonNode b) {
        if (a == null || b == null) return a == b;
        return a.equals(NUMERIC_TOLERANT, b);
    }
}
