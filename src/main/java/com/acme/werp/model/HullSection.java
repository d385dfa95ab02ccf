package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"schemaVersion", "parameters", "totalScore"})
public record HullSection(int schemaVersion, List<Parameter> parameters, double totalScore) {
    public static final int CURRENT_VERSION = 1;
    public static final double PARAMETER_MAX = 5.0;
    public static final double TOTAL_MAX = 20.0;
}
