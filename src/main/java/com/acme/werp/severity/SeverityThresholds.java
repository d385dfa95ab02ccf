package com.acme.werp.severity;

/** Band boundaries: value >= high is "high", value >= medium is "medium", otherwise "low". */
public record SeverityThresholds(double high, double medium) {
    public static final SeverityThresholds DEFAULTS = new SeverityThresholds(7.5, 4.0);

    public SeverityThresholds {
        if (!Double.isFinite(high) || !Double.isFinite(medium) || medium > high) {
            throw new IllegalArgumentException("Invalid severity thresholds: high=" + high + ", medium=" + medium);
        }
    }
}
