package com.acme.werp.normalize;

import com.acme.werp.model.Enums.FactorRole;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Factor;
import com.acme.werp.model.Finding;
import com.acme.werp.model.NormalizedSection;
import com.acme.werp.model.PressureSection;
import com.acme.werp.record.RawParameter;
import com.acme.werp.record.RawSection;
import com.acme.werp.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The multiplier formula follows the factor generation: role-tagged factors are capped per role
 * and add their excess above 1.0; untagged factors are averaged.
 */
public final class PressureNormalizer implements SectionNormalizer<PressureSection> {
    public static final double AVERAGED_MIN = 0.5;
    public static final double AVERAGED_MAX = 2.5;

    @Override public SectionKind kind() { return SectionKind.PRESSURE; }

    @Override
    public NormalizedSection<PressureSection> normalize(RawSection raw) {
        boolean roleCapped = roleCapped(raw);
        List<CanonicalSlot> slots = CanonicalSchemas.pressure(roleCapped);
        List<Finding> findings = new ArrayList<>();
        RawParameter[] resolved = NameResolver.resolve(raw.items(), slots);

        List<Factor> factors = new ArrayList<>(slots.size());
        boolean clamped = false;
        for (int i = 0; i < slots.size(); i++) {
            CanonicalSlot slot = slots.get(i);
            RawParameter p = resolved[i];
            if (p == null) {
                findings.add(Finding.warn("PRESSURE", "Missing factor '" + slot.name() + "' materialized at baseline.",
                        Map.of("factor", slot.name())));
                factors.add(Factor.placeholder(slot.name(), slot.role(), PressureSection.BASELINE));
                continue;
            }
            double rawValue = p.score().orElse(PressureSection.BASELINE);
            double value = ScoreUtil.clamp(rawValue, minFor(slot.role()), maxFor(slot.role()));
            clamped |= value != rawValue;
            factors.add(new Factor(slot.name(), slot.role(), ScoreScaling.rationaleOf(p), value));
        }
        if (clamped) findings.add(Finding.warn("PRESSURE", "Factor values clamped into their legal range."));

        double multiplier = roleCapped ? additiveExcess(factors) : mean(factors);
        multiplier = ScoreUtil.clamp(multiplier, PressureSection.MULTIPLIER_MIN, PressureSection.MULTIPLIER_MAX);
        int version = roleCapped ? PressureSection.ROLE_CAPPED_VERSION : PressureSection.AVERAGED_VERSION;
        return new NormalizedSection<>(new PressureSection(version, List.copyOf(factors), multiplier),
                false, List.copyOf(findings));
    }

    public static boolean roleCapped(RawSection raw) {
        return raw.items().stream().anyMatch(RawParameter::hasRole);
    }

    public static double minFor(FactorRole role) { return role == null ? AVERAGED_MIN : PressureSection.BASELINE; }
    public static double maxFor(FactorRole role) { return role == null ? AVERAGED_MAX : role.cap(); }

    static double additiveExcess(List<Factor> factors) {
        double m = PressureSection.BASELINE;
        for (Factor f : factors) m += Math.max(f.value() - PressureSection.BASELINE, 0.0);
        return m;
    }

    static double mean(List<Factor> factors) {
        double s = 0;
        for (Factor f : factors) s += f.value();
        return ScoreUtil.round2(s / factors.size());
    }
}
