package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record InspectionResult(
        Set<SectionKind> incompleteSections,
        Map<SectionKind, List<ReasonCode>> reasons,
        List<Finding> findings
) {
    public boolean complete() { return incompleteSections.isEmpty(); }

    public boolean incomplete(SectionKind kind) { return incompleteSections.contains(kind); }

    public List<ReasonCode> reasons(SectionKind kind) { return reasons.getOrDefault(kind, List.of()); }
}
