package com.acme.werp.inspect;

import com.acme.werp.model.Enums.FactorRole;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.PressureSection;
import com.acme.werp.normalize.CanonicalSchemas;
import com.acme.werp.normalize.CanonicalSlot;
import com.acme.werp.normalize.PressureNormalizer;
import com.acme.werp.record.RawParameter;
import com.acme.werp.record.RawSection;
import com.acme.werp.util.ScoreUtil;

import java.util.List;

public final class PressureCompletenessCheck implements SectionCheck {
    static final double BASELINE_TOLERANCE = 0.05;

    @Override public SectionKind section() { return SectionKind.PRESSURE; }

    @Override
    public void run(RawSection raw, Placeholders placeholders, InspectionResultBuilder out) {
        SectionKind k = section();
        if (!raw.present()) { out.addReason(k, ReasonCode.SECTION_MISSING); return; }

        List<CanonicalSlot> slots = CanonicalSchemas.pressure(PressureNormalizer.roleCapped(raw));
        List<RawParameter> items = raw.items();
        if (items.size() < slots.size()) out.addReason(k, ReasonCode.PARAMETER_COUNT);
        if (!allRequiredPresent(items, slots)) out.addReason(k, ReasonCode.REQUIRED_NAME_MISSING);
        if (placeholders.count(items) >= NameChecks.PLACEHOLDER_LIMIT) out.addReason(k, ReasonCode.PLACEHOLDER_RATIONALES);
        if (!items.isEmpty() && items.stream().allMatch(PressureCompletenessCheck::atBaseline)) {
            out.addReason(k, ReasonCode.ALL_BASELINE_VALUES);
        }
        if (!raw.total().isPresent()
                || !ScoreUtil.within(raw.total().value(), PressureSection.MULTIPLIER_MIN, PressureSection.MULTIPLIER_MAX)) {
            out.addReason(k, ReasonCode.MULTIPLIER_OUT_OF_RANGE);
        }
    }

    /** Absent values read as baseline. */
    static boolean atBaseline(RawParameter p) {
        return p.score().orElse(PressureSection.BASELINE) <= PressureSection.BASELINE + BASELINE_TOLERANCE;
    }

    private static boolean allRequiredPresent(List<RawParameter> items, List<CanonicalSlot> slots) {
        for (CanonicalSlot slot : slots) {
            boolean found = false;
            for (RawParameter p : items) {
                boolean byRole = slot.role() != null && p.hasRole() && FactorRole.parse(p.role()) == slot.role();
                boolean byName = p.name() != null && p.name().trim().equalsIgnoreCase(slot.name());
                if (byRole || byName) { found = true; break; }
            }
            if (!found) return false;
        }
        return true;
    }
}
