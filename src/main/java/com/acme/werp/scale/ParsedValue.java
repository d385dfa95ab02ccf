package com.acme.werp.scale;

/** A parsed numeric value; percent means it is still expressed in percent units. */
public record ParsedValue(double value, boolean percent, boolean present) {
    public static final ParsedValue ABSENT = new ParsedValue(Double.NaN, false, false);

    public static ParsedValue of(double v) { return new ParsedValue(v, false, true); }
    public static ParsedValue percentOf(double v) { return new ParsedValue(v, true, true); }

    public boolean isPresent() { return present; }
    public double orElse(double fallback) { return present ? value : fallback; }
}
