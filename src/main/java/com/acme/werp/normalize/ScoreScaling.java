package com.acme.werp.normalize;

import com.acme.werp.model.Finding;
import com.acme.werp.model.Parameter;
import com.acme.werp.record.RawParameter;
import com.acme.werp.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Shared steps of the scored (non-factor) sections: 2:1 scale inference, clamping, placeholders. */
final class ScoreScaling {
    private ScoreScaling() {}

    static final double RESCALE_DIVISOR = 2.0;

    /** 2 when the largest raw score in the section exceeds the ceiling, otherwise 1. */
    static double divisorFor(RawParameter[] resolved, double ceiling) {
        double max = Double.NEGATIVE_INFINITY;
        for (RawParameter p : resolved) {
            if (p != null && p.score().isPresent()) max = Math.max(max, p.score().value());
        }
        return max > ceiling ? RESCALE_DIVISOR : 1.0;
    }

    static List<Parameter> toParameters(String category, List<CanonicalSlot> slots, RawParameter[] resolved,
                                        double ceiling, double divisor, List<Finding> findings) {
        List<Parameter> out = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            String name = slots.get(i).name();
            RawParameter p = resolved[i];
            if (p == null) {
                findings.add(Finding.warn(category, "Missing parameter '" + name + "' materialized as placeholder.",
                        Map.of("parameter", name)));
                out.add(Parameter.placeholder(name));
                continue;
            }
            if (p.name() == null || !p.name().trim().equals(name)) {
                findings.add(Finding.ok(category, "Mapped '" + p.name() + "' onto '" + name + "'.",
                        Map.of("from", String.valueOf(p.name()), "to", name)));
            }
            double score = ScoreUtil.clamp(p.score().orElse(0.0) / divisor, 0.0, ceiling);
            out.add(new Parameter(name, rationaleOf(p), score, null));
        }
        return out;
    }

    static String rationaleOf(RawParameter p) {
        String r = p.rationale();
        return (r == null || r.isBlank()) ? Parameter.NOT_SPECIFIED : r;
    }

    static double sum(List<Parameter> params) {
        double s = 0;
        for (Parameter p : params) s += p.score();
        return s;
    }
}
