package com.acme.werp.normalize;

import com.acme.werp.model.*;
import com.acme.werp.util.ScoreUtil;

import java.util.List;

/** Post-normalization guards. A breach is a bug in the normalizers, never bad input. */
public final class RangeInvariants {
    private RangeInvariants() {}

    private static final double EPS = 1e-9;

    public static void verify(Assessment a) {
        if (a.hull() == null) fail(a, "hull section missing");
        verifyScores(a, "wcs", a.hull().parameters(), CanonicalSchemas.HULL, HullSection.PARAMETER_MAX);
        check(a, "wcs.totalScore", a.hull().totalScore(), 0, HullSection.TOTAL_MAX);

        PollutionSection p = a.pollution();
        if (p != null) {
            verifyScores(a, "phs", p.parameters(), CanonicalSchemas.pollution(p.schemaVersion()), PollutionSection.PARAMETER_MAX);
            double sum = 0;
            for (Parameter param : p.parameters()) {
                if (param.weight() == null) fail(a, "phs weight missing on " + param.name());
                check(a, "phs.weight", param.weight(), 0, 1);
                sum += param.weight();
            }
            if (Math.abs(sum - 1.0) > WeightResolver.SUM_TOLERANCE + EPS) fail(a, "phs weights sum to " + sum);
            check(a, "phs.totalWeightedScore", p.totalWeightedScore(), 0, PollutionSection.PARAMETER_MAX);
        }

        SensitivitySection s = a.sensitivity();
        if (s != null) {
            verifyScores(a, "esi", s.parameters(), CanonicalSchemas.SENSITIVITY, SensitivitySection.PARAMETER_MAX);
            check(a, "esi.totalScore", s.totalScore(), 0, s.maxScore());
        }

        PressureSection r = a.pressure();
        if (r != null) {
            List<CanonicalSlot> slots = CanonicalSchemas.pressure(r.roleCapped());
            if (!CanonicalSchemas.names(slots).equals(r.factors().stream().map(Factor::name).toList())) {
                fail(a, "rpm factors are not canonical");
            }
            for (Factor f : r.factors()) {
                check(a, "rpm." + f.name(), f.value(), PressureNormalizer.minFor(f.role()), PressureNormalizer.maxFor(f.role()));
            }
            check(a, "rpm.finalMultiplier", r.finalMultiplier(), PressureSection.MULTIPLIER_MIN, PressureSection.MULTIPLIER_MAX);
        }
    }

    private static void verifyScores(Assessment a, String section, List<Parameter> params, List<CanonicalSlot> slots, double max) {
        if (!CanonicalSchemas.names(slots).equals(params.stream().map(Parameter::name).toList())) {
            fail(a, section + " parameters are not canonical");
        }
        for (Parameter p : params) check(a, section + "." + p.name(), p.score(), 0, max);
    }

    private static void check(Assessment a, String what, double v, double min, double max) {
        if (!Double.isFinite(v) || !ScoreUtil.within(v, min - EPS, max + EPS)) {
            fail(a, what + "=" + v + " outside [" + min + ", " + max + "]");
        }
    }

    private static void fail(Assessment a, String message) {
        throw new IllegalStateException("Range invariant breached for " + a.id() + ": " + message);
    }
}
