package com.acme.werp.record;

import com.acme.werp.scale.ParsedValue;

/**
 * One stored parameter or factor, with aliases already resolved.
 * score carries the "value" field for pressure factors.
 */
public record RawParameter(int index, String name, String rationale, ParsedValue score, ParsedValue weight, String role) {
    public boolean hasWeight() { return weight != null && weight.isPresent(); }
    public boolean hasRole() { return role != null && !role.isBlank(); }
}
