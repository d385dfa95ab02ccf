package com.acme.werp.plan;

import com.acme.werp.inspect.ReasonCode;
import com.acme.werp.model.Enums.SectionKind;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What to do with one record: sections to regenerate, sections to recompute from what is stored,
 * and the Age score dictated by the build year (null when there is none).
 */
public record MigrationPlan(
        String id,
        Set<SectionKind> regenerate,
        Set<SectionKind> recompute,
        Integer ageScore,
        Integer buildYear,
        Map<SectionKind, List<ReasonCode>> reasons
) {
    public boolean ageOverride() { return ageScore != null; }

    public boolean isEmpty() { return regenerate.isEmpty() && recompute.isEmpty() && ageScore == null; }
}
