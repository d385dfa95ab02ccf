package com.acme.werp.normalize;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;
import com.acme.werp.model.NormalizedSection;
import com.acme.werp.model.Parameter;
import com.acme.werp.model.PollutionSection;
import com.acme.werp.record.RawParameter;
import com.acme.werp.record.RawSection;
import com.acme.werp.scale.ParsedValue;
import com.acme.werp.util.ScoreUtil;

import java.util.*;

/**
 * v2 keeps the stored (resolved) weights; v3 always carries the fixed 0.50/0.30/0.20 table.
 * The stored schema version is preserved unless a target version is forced.
 */
public final class PollutionNormalizer implements SectionNormalizer<PollutionSection> {
    @Override public SectionKind kind() { return SectionKind.POLLUTION; }

    @Override
    public NormalizedSection<PollutionSection> normalize(RawSection raw) {
        return normalize(raw, versionOf(raw));
    }

    public NormalizedSection<PollutionSection> normalize(RawSection raw, int targetVersion) {
        int version = targetVersion >= PollutionSection.CURRENT_VERSION
                ? PollutionSection.CURRENT_VERSION : PollutionSection.LEGACY_VERSION;
        List<CanonicalSlot> slots = CanonicalSchemas.pollution(version);
        List<Finding> findings = new ArrayList<>();

        RawParameter[] resolved = NameResolver.resolve(raw.items(), slots);
        double divisor = ScoreScaling.divisorFor(resolved, PollutionSection.PARAMETER_MAX);
        if (divisor != 1.0) {
            findings.add(Finding.warn("POLLUTION", "Scores exceed 0-10; rescaled 2:1.", Map.of("divisor", divisor)));
        }
        List<Parameter> params = ScoreScaling.toParameters("POLLUTION", slots, resolved,
                PollutionSection.PARAMETER_MAX, divisor, findings);

        boolean renormalized = false;
        List<Parameter> weighted = new ArrayList<>(params.size());
        if (version == PollutionSection.CURRENT_VERSION) {
            for (Parameter p : params) weighted.add(p.withWeight(CanonicalSchemas.POLLUTION_V3_WEIGHTS.get(p.name())));
        } else {
            List<ParsedValue> rawWeights = new ArrayList<>();
            for (RawParameter p : resolved) rawWeights.add(p == null ? ParsedValue.ABSENT : p.weight());
            WeightResolution wr = WeightResolver.resolve(rawWeights);
            for (int i = 0; i < params.size(); i++) weighted.add(params.get(i).withWeight(wr.weights().get(i)));
            renormalized = wr.renormalized();
            if (wr.percent()) findings.add(Finding.ok("POLLUTION", "Weights read as percentages."));
            if (wr.renormalized()) findings.add(Finding.warn("POLLUTION", "Weights did not sum to 1; renormalized."));
            if (wr.defaulted()) findings.add(Finding.warn("POLLUTION", "No usable weights; assigned equal weights."));
        }

        double total = 0;
        for (Parameter p : weighted) total += p.score() * p.weight();
        total = ScoreUtil.clamp(total, 0.0, PollutionSection.PARAMETER_MAX);

        if (raw.present() && raw.schemaVersion() != null && raw.schemaVersion() != version) {
            findings.add(Finding.ok("POLLUTION", "Migrated schema v" + raw.schemaVersion() + " to v" + version + ".",
                    Map.of("fromVersion", raw.schemaVersion(), "toVersion", version)));
        }
        return new NormalizedSection<>(new PollutionSection(version, List.copyOf(weighted), total),
                divisor != 1.0 || renormalized, List.copyOf(findings));
    }

    /** Explicit version wins; otherwise exactly the three v3 names means v3, anything else v2. */
    public static int versionOf(RawSection raw) {
        if (raw.schemaVersion() != null) {
            return raw.schemaVersion() >= PollutionSection.CURRENT_VERSION
                    ? PollutionSection.CURRENT_VERSION : PollutionSection.LEGACY_VERSION;
        }
        if (raw.items().size() == CanonicalSchemas.POLLUTION_V3.size()) {
            Set<String> names = new HashSet<>();
            for (RawParameter p : raw.items()) if (p.name() != null) names.add(p.name().trim().toLowerCase(Locale.ROOT));
            boolean allV3 = CanonicalSchemas.POLLUTION_V3.stream()
                    .allMatch(s -> names.contains(s.name().toLowerCase(Locale.ROOT)));
            if (allV3) return PollutionSection.CURRENT_VERSION;
        }
        return PollutionSection.LEGACY_VERSION;
    }
}
