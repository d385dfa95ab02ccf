package com.acme.werp.util;

import com.acme.werp.model.Enums.Severity;
import com.acme.werp.model.Finding;

import java.util.List;

public final class ScoreUtil {
    private ScoreUtil() {}

    public static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.min(max, Math.max(min, v));
    }

    public static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    public static boolean finite(Double v) {
        return v != null && Double.isFinite(v);
    }

    public static boolean within(double v, double min, double max) {
        return v >= min && v <= max;
    }

    public static Severity worst(List<Finding> findings) {
        Severity worst = Severity.OK;
        for (Finding f : findings) {
            if (f.severity() == Severity.ERROR) return Severity.ERROR;
            if (f.severity() == Severity.WARN) worst = Severity.WARN;
        }
        return worst;
    }
}
