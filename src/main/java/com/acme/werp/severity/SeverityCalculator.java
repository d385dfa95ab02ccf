package com.acme.werp.severity;

import com.acme.werp.model.Assessment;
import com.acme.werp.model.Enums.Band;
import com.acme.werp.model.SeverityResult;
import com.acme.werp.util.ScoreUtil;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * severity = (hull + pollution + sensitivity / 3) x multiplier.
 * A missing or non-finite input makes the result UNKNOWN instead of a guess.
 */
public final class SeverityCalculator {
    private final SeverityThresholds thresholds;

    public SeverityCalculator(SeverityThresholds thresholds) {
        this.thresholds = thresholds == null ? SeverityThresholds.DEFAULTS : thresholds;
    }

    public SeverityThresholds thresholds() { return thresholds; }

    public SeverityResult compute(Double hullTotal, Double pollutionTotal, Double sensitivityTotal, Double multiplier) {
        if (!ScoreUtil.finite(hullTotal) || !ScoreUtil.finite(pollutionTotal)
                || !ScoreUtil.finite(sensitivityTotal) || !ScoreUtil.finite(multiplier)) {
            return SeverityResult.UNKNOWN;
        }
        double value = (hullTotal + pollutionTotal + sensitivityTotal / 3.0) * multiplier;
        if (!Double.isFinite(value)) return SeverityResult.UNKNOWN;
        // the band is decided on the exact value; only the stored value is rounded
        return new SeverityResult(ScoreUtil.round2(value), classify(value));
    }

    public SeverityResult compute(Assessment a) {
        return compute(
                a.hull() == null ? null : a.hull().totalScore(),
                a.pollution() == null ? null : a.pollution().totalWeightedScore(),
                a.sensitivity() == null ? null : a.sensitivity().totalScore(),
                a.pressure() == null ? null : a.pressure().finalMultiplier());
    }

    public Band classify(Double value) {
        if (!ScoreUtil.finite(value)) return Band.UNKNOWN;
        if (value >= thresholds.high()) return Band.HIGH;
        if (value >= thresholds.medium()) return Band.MEDIUM;
        return Band.LOW;
    }

    /** Unknown severities are never part of a band, though they still appear in unfiltered listings. */
    public static <T> List<T> inBand(Collection<T> items, Function<T, SeverityResult> severity, Band band) {
        if (band == Band.UNKNOWN) return List.of();
        return items.stream().filter(i -> {
            SeverityResult s = severity.apply(i);
            return s != null && s.known() && s.band() == band;
        }).toList();
    }
}
