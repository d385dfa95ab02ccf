package com.acme.werp.normalize;

import com.acme.werp.model.Enums.FactorRole;
import com.acme.werp.record.RawParameter;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** A canonical parameter name plus the keyword patterns used to recognise aliased input. */
public record CanonicalSlot(String name, FactorRole role, List<Pattern> patterns) {

    static final int NAME_HIT = 2;
    static final int RATIONALE_HIT = 1;

    public static CanonicalSlot of(String name, String... regexes) { return of(name, null, regexes); }

    public static CanonicalSlot of(String name, FactorRole role, String... regexes) {
        return new CanonicalSlot(name, role, Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList());
    }

    public boolean matchesExactly(RawParameter p) {
        if (role != null && p.hasRole() && role == FactorRole.parse(p.role())) return true;
        return p.name() != null && p.name().trim().equalsIgnoreCase(name);
    }

    public int score(RawParameter p) {
        int s = 0;
        for (Pattern pattern : patterns) {
            if (p.name() != null && pattern.matcher(p.name()).find()) s += NAME_HIT;
            if (p.rationale() != null && pattern.matcher(p.rationale()).find()) s += RATIONALE_HIT;
        }
        return s;
    }
}
