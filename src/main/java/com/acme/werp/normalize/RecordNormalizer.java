package com.acme.werp.normalize;

import com.acme.werp.model.*;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.record.RawRecord;
import com.acme.werp.record.RawSection;
import com.acme.werp.severity.SeverityCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Normalizes every section of one record and recomputes its severity. */
public final class RecordNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private final HullNormalizer hull = new HullNormalizer();
    private final PollutionNormalizer pollution = new PollutionNormalizer();
    private final SensitivityNormalizer sensitivity = new SensitivityNormalizer();
    private final PressureNormalizer pressure = new PressureNormalizer();
    private final SeverityCalculator severity;

    public RecordNormalizer(SeverityCalculator severity) {
        this.severity = severity;
    }

    public SeverityCalculator severity() { return severity; }

    public NormalizationResult normalize(RawRecord raw) {
        List<Finding> diagnostics = new ArrayList<>();
        EnumSet<SectionKind> corrected = EnumSet.noneOf(SectionKind.class);

        // hull is always synthesized, even from nothing
        HullSection h = collect(SectionKind.HULL, hull.normalize(raw.section(SectionKind.HULL)), diagnostics, corrected);
        PollutionSection p = presentOrNull(raw, SectionKind.POLLUTION, pollution, diagnostics, corrected);
        SensitivitySection s = presentOrNull(raw, SectionKind.SENSITIVITY, sensitivity, diagnostics, corrected);
        PressureSection r = presentOrNull(raw, SectionKind.PRESSURE, pressure, diagnostics, corrected);

        Assessment draft = new Assessment(raw.id(), raw.vesselName(), h, p, s, r, null, raw.buildYear(), raw.updatedAt());
        Assessment a = withSeverity(draft);
        RangeInvariants.verify(a);

        if (!corrected.isEmpty()) logger.debug("Record {} corrected sections {}", raw.id(), corrected);
        return new NormalizationResult(a, List.copyOf(diagnostics), Collections.unmodifiableSet(corrected));
    }

    /** Normalizes a single section; pollution can be pinned to a target schema version. */
    public NormalizedSection<?> normalizeSection(RawSection raw, Integer pollutionVersion) {
        return switch (raw.kind()) {
            case HULL -> hull.normalize(raw);
            case POLLUTION -> pollutionVersion == null ? pollution.normalize(raw) : pollution.normalize(raw, pollutionVersion);
            case SENSITIVITY -> sensitivity.normalize(raw);
            case PRESSURE -> pressure.normalize(raw);
        };
    }

    public Assessment withSeverity(Assessment a) {
        return new Assessment(a.id(), a.vesselName(), a.hull(), a.pollution(), a.sensitivity(), a.pressure(),
                severity.compute(a), a.buildYear(), a.updatedAt());
    }

    private <S> S presentOrNull(RawRecord raw, SectionKind kind, SectionNormalizer<S> normalizer,
                                List<Finding> diagnostics, Set<SectionKind> corrected) {
        RawSection section = raw.section(kind);
        if (!section.present()) return null;
        return collect(kind, normalizer.normalize(section), diagnostics, corrected);
    }

    private static <S> S collect(SectionKind kind, NormalizedSection<S> n, List<Finding> diagnostics, Set<SectionKind> corrected) {
        diagnostics.addAll(n.findings());
        if (n.corrected()) corrected.add(kind);
        return n.section();
    }
}
