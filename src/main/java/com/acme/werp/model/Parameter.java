package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "rationale", "score", "weight"})
public record Parameter(String name, String rationale, double score, Double weight) {
    public static final String INSUFFICIENT_DATA = "Insufficient data.";
    public static final String NOT_SPECIFIED = "Not specified.";

    public static Parameter placeholder(String name) { return new Parameter(name, INSUFFICIENT_DATA, 0.0, null); }

    public Parameter withScore(double s) { return new Parameter(name, rationale, s, weight); }
    public Parameter withRationale(String r) { return new Parameter(name, r, score, weight); }
    public Parameter withWeight(Double w) { return new Parameter(name, rationale, score, w); }
}
