package com.acme.werp.normalize;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;
import com.acme.werp.model.NormalizedSection;
import com.acme.werp.model.Parameter;
import com.acme.werp.model.SensitivitySection;
import com.acme.werp.record.RawParameter;
import com.acme.werp.record.RawSection;
import com.acme.werp.util.ScoreUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class SensitivityNormalizer implements SectionNormalizer<SensitivitySection> {
    @Override public SectionKind kind() { return SectionKind.SENSITIVITY; }

    @Override
    public NormalizedSection<SensitivitySection> normalize(RawSection raw) {
        List<Finding> findings = new ArrayList<>();
        RawParameter[] resolved = NameResolver.resolve(raw.items(), CanonicalSchemas.SENSITIVITY);

        double divisor = ScoreScaling.divisorFor(resolved, SensitivitySection.PARAMETER_MAX);
        if (divisor != 1.0) {
            findings.add(Finding.warn("SENSITIVITY", "Scores exceed 0-10; rescaled 2:1.", Map.of("divisor", divisor)));
        }
        List<Parameter> params = ScoreScaling.toParameters("SENSITIVITY", CanonicalSchemas.SENSITIVITY, resolved,
                SensitivitySection.PARAMETER_MAX, divisor, findings);

        double maxScore = maxScoreOf(raw);
        int version = maxScore == SensitivitySection.LEGACY_MAX_SCORE ? 1 : 2;
        double total = ScoreUtil.clamp(ScoreScaling.sum(params), 0.0, maxScore);
        return new NormalizedSection<>(new SensitivitySection(version, List.copyOf(params), total, maxScore),
                divisor != 1.0, List.copyOf(findings));
    }

    /** The stored maxScore decides the variant; a bare schemaVersion 1 also means the 30-point one. */
    static double maxScoreOf(RawSection raw) {
        if (raw.maxScore().isPresent()) {
            return raw.maxScore().value() <= SensitivitySection.LEGACY_MAX_SCORE
                    ? SensitivitySection.LEGACY_MAX_SCORE : SensitivitySection.CURRENT_MAX_SCORE;
        }
        if (raw.schemaVersion() != null && raw.schemaVersion() == 1) return SensitivitySection.LEGACY_MAX_SCORE;
        return SensitivitySection.CURRENT_MAX_SCORE;
    }
}
