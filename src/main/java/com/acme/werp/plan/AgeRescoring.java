package com.acme.werp.plan;

import com.acme.werp.model.HullSection;
import com.acme.werp.model.Parameter;
import com.acme.werp.normalize.CanonicalSchemas;
import com.acme.werp.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Hull "Age" derived from the documented build year; it overrides any assessed value. */
public final class AgeRescoring {
    private AgeRescoring() {}

    private static final Pattern ANNOTATED = Pattern.compile("build year", Pattern.CASE_INSENSITIVE);

    /** null when the build year is unknown. */
    public static Integer score(Integer buildYear, int currentYear) {
        if (buildYear == null || buildYear <= 0) return null;
        int age = currentYear - buildYear;
        if (age >= 120) return 5;
        if (age >= 90) return 4;
        if (age >= 60) return 3;
        if (age >= 30) return 2;
        return 1;
    }

    public static String suffix(int buildYear) { return " (Rescored from build year " + buildYear + ".)"; }

    public static String annotate(String rationale, int buildYear) {
        String r = rationale == null ? "" : rationale;
        if (ANNOTATED.matcher(r).find()) return r;
        return r.stripTrailing() + suffix(buildYear);
    }

    public static HullSection apply(HullSection hull, int score, int buildYear) {
        List<Parameter> params = new ArrayList<>(hull.parameters().size());
        double total = 0;
        for (Parameter p : hull.parameters()) {
            Parameter q = CanonicalSchemas.AGE.equals(p.name())
                    ? p.withScore(score).withRationale(annotate(p.rationale(), buildYear))
                    : p;
            params.add(q);
            total += q.score();
        }
        return new HullSection(hull.schemaVersion(), List.copyOf(params),
                ScoreUtil.clamp(total, 0.0, HullSection.TOTAL_MAX));
    }
}
