package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** maxScore 30 marks the older variant (schemaVersion 1), 40 the current one. */
@JsonPropertyOrder({"schemaVersion", "parameters", "totalScore", "maxScore"})
public record SensitivitySection(int schemaVersion, List<Parameter> parameters, double totalScore, double maxScore) {
    public static final double PARAMETER_MAX = 10.0;
    public static final double LEGACY_MAX_SCORE = 30.0;
    public static final double CURRENT_MAX_SCORE = 40.0;
}
