package com.acme.werp.scale;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

/**
 * Parses numbers, numeric strings (optionally ending in '%') and missing values.
 * Never throws: anything it cannot read comes back as {@link ParsedValue#ABSENT}.
 */
public final class ScaleParser {
    private ScaleParser() {}

    public static final Set<String> WEIGHT_KEYS = Set.of(
            "weight", "weightpercent", "weight_percent", "weightpct", "percent", "pct");

    private static final double PERCENT_MAGNITUDE = 1.5;

    public static ParsedValue parse(Object raw) { return parse(raw, null); }

    /** key is the field the value was read from; weight-like keys with magnitude above 1.5 mean percent units. */
    public static ParsedValue parse(Object raw, String key) {
        Object v = unwrap(raw);
        if (v == null) return ParsedValue.ABSENT;

        boolean percentSign = false;
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else {
            String s = v.toString().trim();
            if (s.endsWith("%")) {
                percentSign = true;
                s = s.substring(0, s.length() - 1).trim();
            }
            if (s.isEmpty()) return ParsedValue.ABSENT;
            try { d = Double.parseDouble(s); }
            catch (NumberFormatException e) { return ParsedValue.ABSENT; }
        }
        if (!Double.isFinite(d)) return ParsedValue.ABSENT;

        boolean weightKey = isWeightKey(key);
        boolean percent = percentSign || (weightKey && Math.abs(d) > PERCENT_MAGNITUDE);
        return percent ? ParsedValue.percentOf(d) : ParsedValue.of(d);
    }

    public static boolean isWeightKey(String key) {
        return key != null && WEIGHT_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }

    private static Object unwrap(Object raw) {
        if (!(raw instanceof JsonNode node)) return raw;
        if (node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) return node.numberValue();
        if (node.isTextual()) return node.textValue();
        return null;
    }
}
