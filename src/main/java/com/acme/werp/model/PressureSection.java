package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * schemaVersion 1: role-tagged factors, multiplier = 1.0 + sum of excess above 1.0.
 * schemaVersion 2: untagged factors, multiplier = mean of factor values.
 */
@JsonPropertyOrder({"schemaVersion", "factors", "finalMultiplier"})
public record PressureSection(int schemaVersion, List<Factor> factors, double finalMultiplier) {
    public static final int ROLE_CAPPED_VERSION = 1;
    public static final int AVERAGED_VERSION = 2;
    public static final double BASELINE = 1.0;
    public static final double MULTIPLIER_MIN = 0.5;
    public static final double MULTIPLIER_MAX = 2.5;

    public boolean roleCapped() { return schemaVersion == ROLE_CAPPED_VERSION; }
}
