package com.acme.werp.inspect;

/** Why a section is incomplete; recomputable reasons can be fixed without regenerating content. */
public enum ReasonCode {
    SECTION_MISSING(false),
    SCHEMA_VERSION_OUTDATED(true),
    PARAMETER_COUNT(true),
    REQUIRED_NAME_MISSING(false),
    WEIGHT_MISSING(true),
    TOTAL_NOT_FINITE(true),
    PLACEHOLDER_RATIONALES(false),
    ALL_BASELINE_VALUES(false),
    MULTIPLIER_OUT_OF_RANGE(true),
    CHECK_FAILED(false);

    private final boolean recomputable;
    ReasonCode(boolean recomputable) { this.recomputable = recomputable; }
    public boolean recomputable() { return recomputable; }
}
