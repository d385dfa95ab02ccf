package com.acme.werp.normalize;

import com.acme.werp.record.RawParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns stored parameters to canonical slots. Exact names (or roles) win outright; the rest are
 * placed by descending keyword score, the first-seen candidate and then the earlier slot winning ties.
 */
public final class NameResolver {
    private NameResolver() {}

    /** Returns one entry per slot, in slot order; null where no candidate matched. */
    public static RawParameter[] resolve(List<RawParameter> raw, List<CanonicalSlot> slots) {
        RawParameter[] assigned = new RawParameter[slots.size()];
        boolean[] used = new boolean[raw.size()];

        for (int s = 0; s < slots.size(); s++) {
            for (int i = 0; i < raw.size(); i++) {
                if (!used[i] && slots.get(s).matchesExactly(raw.get(i))) {
                    assigned[s] = raw.get(i);
                    used[i] = true;
                    break;
                }
            }
        }

        // every (candidate, free slot) keyword hit, best first; a candidate that loses one slot
        // still competes for its other slots
        List<int[]> hits = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            if (used[i]) continue;
            for (int s = 0; s < slots.size(); s++) {
                if (assigned[s] != null) continue;
                int score = slots.get(s).score(raw.get(i));
                if (score > 0) hits.add(new int[] {score, i, s});
            }
        }
        hits.sort(Comparator.<int[]>comparingInt(h -> -h[0]).thenComparingInt(h -> h[1]).thenComparingInt(h -> h[2]));
        for (int[] h : hits) {
            int i = h[1];
            int s = h[2];
            if (used[i] || assigned[s] != null) continue;
            assigned[s] = raw.get(i);
            used[i] = true;
        }
        return assigned;
    }

    public static long matched(RawParameter[] assigned) {
        return Arrays.stream(assigned).filter(p -> p != null).count();
    }
}
