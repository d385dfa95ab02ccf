package com.acme.werp.regen;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.record.RawRecordReader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls section JSON out of free model text. */
public final class RegenerationParser {
    private static final Pattern JSON_FENCE = Pattern.compile("```json([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_FENCE = Pattern.compile("```([\\s\\S]*?)```");

    private final ObjectMapper mapper;

    public RegenerationParser(ObjectMapper mapper) { this.mapper = mapper; }

    /** A ```json fence, else any fence, else the span from the first '{' to the last '}'. */
    public static String extractJson(String text) {
        String s = text == null ? "" : text;
        Matcher m = JSON_FENCE.matcher(s);
        if (m.find() && !m.group(1).isBlank()) return m.group(1).trim();
        m = BARE_FENCE.matcher(s);
        if (m.find() && !m.group(1).isBlank()) return m.group(1).trim();
        int first = s.indexOf('{');
        int last = s.lastIndexOf('}');
        if (first >= 0 && last > first) return s.substring(first, last + 1);
        return s.trim();
    }

    public JsonNode parse(String text) throws RegenerationException {
        String candidate = extractJson(text);
        try {
            JsonNode root = mapper.readTree(candidate);
            if (root == null || !root.isObject()) throw new RegenerationException("Model output is not a JSON object");
            return root;
        } catch (JsonProcessingException e) {
            throw new RegenerationException("Model output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Picks the requested sections out of a reply; a lone section may be returned unwrapped. */
    public static Map<SectionKind, JsonNode> sectionsFrom(JsonNode root, Set<SectionKind> requested) {
        Map<SectionKind, JsonNode> out = new EnumMap<>(SectionKind.class);
        for (SectionKind k : requested) {
            JsonNode n = RawRecordReader.sectionNode(root, k);
            if (n != null) out.put(k, n);
        }
        if (out.isEmpty() && requested.size() == 1 && (root.has("parameters") || root.has("factors"))) {
            out.put(requested.iterator().next(), root);
        }
        return out;
    }

    public static boolean hasExpectedShape(SectionKind kind, JsonNode node) {
        if (node == null || !node.isObject()) return false;
        JsonNode arr = kind == SectionKind.PRESSURE ? node.get("factors") : node.get("parameters");
        if (arr == null || !arr.isArray() || arr.isEmpty()) return false;
        for (JsonNode item : arr) if (!item.isObject()) return false;
        return true;
    }
}
