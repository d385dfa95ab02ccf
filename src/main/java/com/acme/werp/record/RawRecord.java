package com.acme.werp.record;

import com.acme.werp.model.Enums.SectionKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/** Read-only typed view over a stored, loosely shaped record. */
public record RawRecord(
        String id,
        String vesselName,
        String context,
        Map<SectionKind, RawSection> sections,
        Integer buildYear,
        Instant updatedAt,
        JsonNode severity,
        JsonNode source
) {
    public RawSection section(SectionKind kind) {
        RawSection s = sections.get(kind);
        return s == null ? RawSection.absent(kind) : s;
    }
}
