package com.acme.werp.record;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.scale.ParsedValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** total is totalScore, totalWeightedScore or finalMultiplier depending on the section. */
public record RawSection(
        SectionKind kind,
        boolean present,
        Integer schemaVersion,
        List<RawParameter> items,
        ParsedValue total,
        ParsedValue maxScore,
        JsonNode source
) {
    public static RawSection absent(SectionKind kind) {
        return new RawSection(kind, false, null, List.of(), ParsedValue.ABSENT, ParsedValue.ABSENT, null);
    }
}
