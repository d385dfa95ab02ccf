package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A normalized WERP assessment. Sections absent from the stored record stay null,
 * except hull which is always synthesized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "vesselName", "wcs", "phs", "esi", "rpm", "severity", "metadata", "updatedAt"})
public record Assessment(
        String id,
        String vesselName,
        @JsonProperty("wcs") HullSection hull,
        @JsonProperty("phs") PollutionSection pollution,
        @JsonProperty("esi") SensitivitySection sensitivity,
        @JsonProperty("rpm") PressureSection pressure,
        SeverityResult severity,
        @JsonIgnore Integer buildYear,
        Instant updatedAt
) {
    @JsonProperty("metadata")
    public Map<String, Object> metadata() {
        if (buildYear == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("buildYear", buildYear);
        return m;
    }

    public Object section(Enums.SectionKind kind) {
        return switch (kind) {
            case HULL -> hull;
            case POLLUTION -> pollution;
            case SENSITIVITY -> sensitivity;
            case PRESSURE -> pressure;
        };
    }
}
