package com.acme.werp.model;

import com.acme.werp.model.Enums.FactorRole;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "role", "rationale", "value"})
public record Factor(String name, FactorRole role, String rationale, double value) {
    public static Factor placeholder(String name, FactorRole role, double baseline) {
        return new Factor(name, role, Parameter.INSUFFICIENT_DATA, baseline);
    }
}
