package com.acme.werp.normalize;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;
import com.acme.werp.model.HullSection;
import com.acme.werp.model.NormalizedSection;
import com.acme.werp.model.Parameter;
import com.acme.werp.record.RawParameter;
import com.acme.werp.record.RawSection;
import com.acme.werp.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class HullNormalizer implements SectionNormalizer<HullSection> {
    @Override public SectionKind kind() { return SectionKind.HULL; }

    @Override
    public NormalizedSection<HullSection> normalize(RawSection raw) {
        List<Finding> findings = new ArrayList<>();
        RawParameter[] resolved = NameResolver.resolve(raw.items(), CanonicalSchemas.HULL);

        double divisor = ScoreScaling.divisorFor(resolved, HullSection.PARAMETER_MAX);
        if (divisor != 1.0) {
            findings.add(Finding.warn("HULL", "Scores exceed 0-5; rescaled 2:1.", Map.of("divisor", divisor)));
        }

        List<Parameter> params = ScoreScaling.toParameters("HULL", CanonicalSchemas.HULL, resolved,
                HullSection.PARAMETER_MAX, divisor, findings);
        double total = ScoreUtil.clamp(ScoreScaling.sum(params), 0.0, HullSection.TOTAL_MAX);
        return new NormalizedSection<>(new HullSection(HullSection.CURRENT_VERSION, List.copyOf(params), total),
                divisor != 1.0, List.copyOf(findings));
    }
}
