package com.acme.werp.inspect;

import com.acme.werp.record.RawParameter;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Rationales that carry no information. Matching is exact after trim and lower-casing. */
public final class Placeholders {
    public static final Set<String> DEFAULTS = Set.of("", "not specified.", "insufficient data.", "unknown.");

    private final Set<String> values;

    public Placeholders(Set<String> values) {
        this.values = values.stream().map(Placeholders::key).collect(Collectors.toUnmodifiableSet());
    }

    public static Placeholders defaults() { return new Placeholders(DEFAULTS); }

    public boolean isPlaceholder(String rationale) {
        return values.contains(rationale == null ? "" : key(rationale));
    }

    public long count(List<RawParameter> items) {
        return items.stream().filter(p -> isPlaceholder(p.rationale())).count();
    }

    public Set<String> values() { return values; }

    private static String key(String s) { return s.trim().toLowerCase(Locale.ROOT); }
}
