package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"schemaVersion", "parameters", "totalWeightedScore"})
public record PollutionSection(int schemaVersion, List<Parameter> parameters, double totalWeightedScore) {
    public static final int LEGACY_VERSION = 2;
    public static final int CURRENT_VERSION = 3;
    public static final double PARAMETER_MAX = 10.0;
}
