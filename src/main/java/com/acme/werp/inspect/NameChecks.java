package com.acme.werp.inspect;

import com.acme.werp.record.RawParameter;

import java.util.*;

final class NameChecks {
    private NameChecks() {}

    static final int PLACEHOLDER_LIMIT = 2;

    static Set<String> names(List<RawParameter> items) {
        Set<String> names = new HashSet<>();
        for (RawParameter p : items) if (p.name() != null) names.add(p.name().trim().toLowerCase(Locale.ROOT));
        return names;
    }

    static boolean allPresent(List<RawParameter> items, List<String> required) {
        Set<String> names = names(items);
        return required.stream().allMatch(r -> names.contains(r.toLowerCase(Locale.ROOT)));
    }
}
