package com.acme.werp.normalize;

import com.acme.werp.scale.ParsedValue;

import java.util.ArrayList;
import java.util.List;

/** Turns ad-hoc stored weights into fractions that sum to 1. */
public final class WeightResolver {
    private WeightResolver() {}

    public static final double SUM_TOLERANCE = 0.01;
    static final double PERCENT_SUM_LOW = 85.0;
    static final double PERCENT_SUM_HIGH = 115.0;

    public static WeightResolution resolve(List<ParsedValue> raw) {
        int n = raw.size();
        if (n == 0) return new WeightResolution(List.of(), false, false, true);

        double presentSum = 0;
        int presentCount = 0;
        boolean percentMarker = false;
        for (ParsedValue v : raw) {
            if (!v.isPresent()) continue;
            presentSum += Math.max(0, v.value());
            presentCount++;
            percentMarker |= v.percent();
        }
        if (presentCount == 0 || presentSum <= 0) return equal(n);

        boolean percent = percentMarker || (presentSum >= PERCENT_SUM_LOW && presentSum <= PERCENT_SUM_HIGH);
        double divisor = percent ? 100.0 : 1.0;
        double fill = (presentSum / divisor) / presentCount;

        List<Double> weights = new ArrayList<>(n);
        double sum = 0;
        for (ParsedValue v : raw) {
            double w = v.isPresent() ? Math.max(0, v.value()) / divisor : fill;
            weights.add(w);
            sum += w;
        }

        boolean renormalized = false;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            for (int i = 0; i < n; i++) weights.set(i, weights.get(i) / sum);
            renormalized = true;
        }
        return new WeightResolution(List.copyOf(weights), percent, renormalized, false);
    }

    static WeightResolution equal(int n) {
        List<Double> weights = new ArrayList<>(n);
        for (int i = 0; i < n; i++) weights.add(1.0 / n);
        return new WeightResolution(List.copyOf(weights), false, false, true);
    }
}
