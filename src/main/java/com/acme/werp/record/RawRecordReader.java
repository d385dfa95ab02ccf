package com.acme.werp.record;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.scale.ParsedValue;
import com.acme.werp.scale.ScaleParser;
import com.acme.werp.util.Slugs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Resolves the field aliases found across stored WERP records in one place, so callers
 * work against {@link RawRecord} instead of probing JSON paths.
 */
public final class RawRecordReader {

    static final Map<SectionKind, List<String>> SECTION_KEYS = Map.of(
            SectionKind.HULL, List.of("wcs", "hull", "wcs_hull_structure"),
            SectionKind.POLLUTION, List.of("phs", "pollution", "phs_pollution_hazard"),
            SectionKind.SENSITIVITY, List.of("esi", "sensitivity", "esi_environmental_sensitivity"),
            SectionKind.PRESSURE, List.of("rpm", "pressure", "rpm_risk_pressure_modifiers")
    );

    private static final List<String> NAME_KEYS = List.of("name", "parameter", "title", "factor");
    private static final List<String> SCORE_KEYS = List.of("score", "value");
    private static final List<String> WEIGHT_KEYS = List.of("weight", "weightPercent", "weight_percent", "weightPct", "percent", "pct");
    private static final List<String> VERSION_KEYS = List.of("schemaVersion", "version");

    public RawRecord read(JsonNode doc) { return read(null, doc); }

    public RawRecord read(String storedId, JsonNode doc) {
        JsonNode d = doc == null ? MissingNode.getInstance() : doc;
        String vesselName = firstText(d, List.of("vesselName", "vessel", "name"));
        String id = storedId != null ? storedId : firstText(d, List.of("id"));
        if (id == null || id.isBlank()) id = Slugs.fromVesselName(vesselName);

        Map<SectionKind, RawSection> sections = new EnumMap<>(SectionKind.class);
        for (SectionKind kind : SectionKind.values()) {
            JsonNode node = sectionNode(d, kind);
            sections.put(kind, node == null ? RawSection.absent(kind) : readSection(kind, node));
        }

        JsonNode summary = d.path("phase1").path("summary");
        String context = joinNonBlank(text(summary.get("background")), text(summary.get("location")));

        return new RawRecord(id, vesselName == null ? id : vesselName, context, Map.copyOf(sections),
                buildYear(d.path("metadata").get("buildYear")), instant(d.get("updatedAt")),
                d.get("severity"), d);
    }

    /** Finds a section under any of its known keys; null when none is an object. */
    public static JsonNode sectionNode(JsonNode doc, SectionKind kind) {
        for (String key : SECTION_KEYS.get(kind)) {
            JsonNode n = doc.get(key);
            if (n != null && n.isObject()) return n;
        }
        return null;
    }

    public RawSection readSection(SectionKind kind, JsonNode node) {
        JsonNode arr = kind == SectionKind.PRESSURE ? firstArray(node, "factors", "parameters") : firstArray(node, "parameters", "factors");
        List<RawParameter> items = new ArrayList<>();
        if (arr != null) {
            int i = 0;
            for (JsonNode item : arr) {
                if (item != null && item.isObject()) items.add(readParameter(i, item));
                i++;
            }
        }
        ParsedValue total = switch (kind) {
            case HULL, SENSITIVITY -> ScaleParser.parse(node.get("totalScore"));
            case POLLUTION -> ScaleParser.parse(node.get("totalWeightedScore"));
            case PRESSURE -> ScaleParser.parse(node.get("finalMultiplier"));
        };
        Integer version = null;
        for (String k : VERSION_KEYS) {
            ParsedValue v = ScaleParser.parse(node.get(k));
            if (v.isPresent()) { version = (int) Math.round(v.value()); break; }
        }
        return new RawSection(kind, true, version, List.copyOf(items), total,
                ScaleParser.parse(node.get("maxScore")), node);
    }

    RawParameter readParameter(int index, JsonNode item) {
        String name = firstText(item, NAME_KEYS);
        ParsedValue score = ParsedValue.ABSENT;
        for (String k : SCORE_KEYS) {
            score = ScaleParser.parse(item.get(k), k);
            if (score.isPresent()) break;
        }
        ParsedValue weight = ParsedValue.ABSENT;
        for (String k : WEIGHT_KEYS) {
            JsonNode w = item.get(k);
            if (w == null || w.isNull()) continue;
            weight = ScaleParser.parse(w, k);
            break;
        }
        return new RawParameter(index, name, text(item.get("rationale")), score, weight, text(item.get("role")));
    }

    private static JsonNode firstArray(JsonNode node, String... keys) {
        for (String k : keys) {
            JsonNode n = node.get(k);
            if (n != null && n.isArray()) return n;
        }
        return null;
    }

    private static String firstText(JsonNode node, List<String> keys) {
        for (String k : keys) {
            String s = text(node.get(k));
            if (s != null && !s.isBlank()) return s.trim();
        }
        return null;
    }

    private static String text(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode() || n.isContainerNode()) return null;
        return n.asText();
    }

    private static String joinNonBlank(String a, String b) {
        StringJoiner j = new StringJoiner(" ");
        if (a != null && !a.isBlank()) j.add(a.trim());
        if (b != null && !b.isBlank()) j.add("Location: " + b.trim());
        return j.toString();
    }

    private static Integer buildYear(JsonNode n) {
        ParsedValue v = ScaleParser.parse(n);
        if (!v.isPresent() || v.value() <= 0) return null;
        return (int) v.value();
    }

    private static Instant instant(JsonNode n) {
        String s = text(n);
        if (s == null || s.isBlank()) return null;
        try { return Instant.parse(s.trim()); }
        catch (DateTimeParseException e) { return null; }
    }
}
