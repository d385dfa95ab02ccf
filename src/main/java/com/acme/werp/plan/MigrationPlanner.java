package com.acme.werp.plan;

import com.acme.werp.inspect.CompletenessInspector;
import com.acme.werp.inspect.InspectionResult;
import com.acme.werp.inspect.ReasonCode;
import com.acme.werp.model.*;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.normalize.NormalizationResult;
import com.acme.werp.normalize.RecordNormalizer;
import com.acme.werp.record.RawRecord;
import com.acme.werp.record.RawRecordReader;
import com.acme.werp.record.RawSection;
import com.acme.werp.regen.RegenerationException;
import com.acme.werp.regen.RegenerationParser;
import com.acme.werp.regen.RegenerationRequest;
import com.acme.werp.regen.SectionRegenerator;
import com.acme.werp.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Builds the smallest patch that makes a record complete. Only incomplete sections are touched;
 * a section is recomputed from its stored content when every reason against it is mechanical,
 * otherwise it is regenerated. The build-year Age rule is applied last and always wins.
 */
public final class MigrationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationPlanner.class);

    private final RawRecordReader reader;
    private final RecordNormalizer normalizer;
    private final CompletenessInspector inspector;
    private final PollutionMigration pollutionMigration = new PollutionMigration();
    private final ObjectMapper mapper;
    private final Clock clock;

    public MigrationPlanner(RawRecordReader reader, RecordNormalizer normalizer, CompletenessInspector inspector,
                            ObjectMapper mapper, Clock clock) {
        this.reader = reader;
        this.normalizer = normalizer;
        this.inspector = inspector;
        this.mapper = mapper;
        this.clock = clock;
    }

    public MigrationPlan plan(RawRecord raw) {
        return plan(raw, inspector.inspect(raw));
    }

    public MigrationPlan plan(RawRecord raw, InspectionResult inspection) {
        EnumSet<SectionKind> regenerate = EnumSet.noneOf(SectionKind.class);
        EnumSet<SectionKind> recompute = EnumSet.noneOf(SectionKind.class);
        for (SectionKind k : inspection.incompleteSections()) {
            boolean mechanical = inspection.reasons(k).stream().allMatch(ReasonCode::recomputable);
            (mechanical ? recompute : regenerate).add(k);
        }
        Integer ageScore = AgeRescoring.score(raw.buildYear(), clock.instant().atZone(ZoneOffset.UTC).getYear());
        return new MigrationPlan(raw.id(), Collections.unmodifiableSet(regenerate), Collections.unmodifiableSet(recompute),
                ageScore, raw.buildYear(), inspection.reasons());
    }

    public RecordPatch planAndApply(RawRecord raw, SectionRegenerator regenerator) {
        return apply(raw, plan(raw), regenerator);
    }

    /** A null regenerator means dry run: sections needing regeneration are reported as pending. */
    public RecordPatch apply(RawRecord raw, MigrationPlan plan, SectionRegenerator regenerator) {
        NormalizationResult base = normalizer.normalize(raw);
        Assessment stored = base.assessment();
        Map<SectionKind, Object> merged = new EnumMap<>(SectionKind.class);
        for (SectionKind k : SectionKind.values()) {
            Object s = stored.section(k);
            if (s != null) merged.put(k, s);
        }

        List<Finding> findings = new ArrayList<>(base.diagnostics());
        EnumSet<SectionKind> touched = EnumSet.noneOf(SectionKind.class);
        EnumSet<SectionKind> recomputed = EnumSet.noneOf(SectionKind.class);
        EnumSet<SectionKind> regenerated = EnumSet.noneOf(SectionKind.class);
        EnumSet<SectionKind> failed = EnumSet.noneOf(SectionKind.class);
        EnumSet<SectionKind> pending = EnumSet.noneOf(SectionKind.class);

        for (SectionKind k : plan.recompute()) {
            Object section = k == SectionKind.POLLUTION
                    ? pollutionMigration.migrate(raw.section(k)).section()
                    : merged.get(k);
            if (section == null) continue;
            merged.put(k, section);
            touched.add(k);
            recomputed.add(k);
        }

        if (!plan.regenerate().isEmpty()) {
            if (regenerator == null) {
                pending.addAll(plan.regenerate());
            } else {
                regenerate(raw, plan.regenerate(), regenerator, merged, findings, regenerated, failed);
                touched.addAll(regenerated);
            }
        }

        boolean ageRescored = false;
        if (plan.ageOverride()) {
            HullSection hull = AgeRescoring.apply((HullSection) merged.get(SectionKind.HULL), plan.ageScore(), plan.buildYear());
            merged.put(SectionKind.HULL, hull);
            touched.add(SectionKind.HULL);
        }

        // only sections whose stored form actually changes go into the patch
        Map<SectionKind, Object> changed = new EnumMap<>(SectionKind.class);
        for (SectionKind k : touched) {
            Object section = merged.get(k);
            JsonNode before = raw.section(k).source();
            if (section != null && !JsonSupport.sameTree(before, mapper.valueToTree(section))) {
                changed.put(k, section);
                if (k == SectionKind.HULL && plan.ageOverride()) ageRescored = true;
            }
        }

        Assessment next = normalizer.withSeverity(new Assessment(raw.id(), raw.vesselName(),
                (HullSection) merged.get(SectionKind.HULL),
                (PollutionSection) merged.get(SectionKind.POLLUTION),
                (SensitivitySection) merged.get(SectionKind.SENSITIVITY),
                (PressureSection) merged.get(SectionKind.PRESSURE),
                null, raw.buildYear(), raw.updatedAt()));
        SeverityResult severity = next.severity();
        boolean severityChanged = !JsonSupport.sameTree(raw.severity(), mapper.valueToTree(severity));

        return new RecordPatch(raw.id(), Collections.unmodifiableMap(changed),
                (severityChanged || !changed.isEmpty()) ? severity : null,
                clock.instant(),
                Collections.unmodifiableSet(regenerated), Collections.unmodifiableSet(recomputed),
                Collections.unmodifiableSet(failed), Collections.unmodifiableSet(pending),
                ageRescored, List.copyOf(findings));
    }

    private void regenerate(RawRecord raw, Set<SectionKind> wanted, SectionRegenerator regenerator,
                            Map<SectionKind, Object> merged, List<Finding> findings,
                            Set<SectionKind> regenerated, Set<SectionKind> failed) {
        Map<SectionKind, JsonNode> candidates;
        try {
            candidates = regenerator.regenerate(new RegenerationRequest(raw.id(), raw.vesselName(), raw.context(), wanted));
        } catch (RegenerationException e) {
            logger.warn("Regeneration failed for {}: {}", raw.id(), e.getMessage());
            failed.addAll(wanted);
            findings.add(Finding.err("REGENERATION", "Regeneration failed: " + e.getMessage(), Map.of("sections", wanted)));
            return;
        }
        for (SectionKind k : wanted) {
            JsonNode node = candidates == null ? null : candidates.get(k);
            if (!RegenerationParser.hasExpectedShape(k, node)) {
                failed.add(k);
                findings.add(Finding.err("REGENERATION", "Regenerated '" + k.key() + "' has the wrong shape."));
                continue;
            }
            RawSection candidate = reader.readSection(k, node);
            Integer pinned = k == SectionKind.POLLUTION ? PollutionSection.CURRENT_VERSION : null;
            NormalizedSection<?> normalized = normalizer.normalizeSection(candidate, pinned);

            // the normalized candidate must itself pass inspection before it is accepted
            RawSection reread = reader.readSection(k, mapper.valueToTree(normalized.section()));
            InspectionResult check = inspector.inspect(reread);
            if (check.incomplete(k)) {
                failed.add(k);
                findings.add(Finding.err("REGENERATION", "Regenerated '" + k.key() + "' is still incomplete.",
                        Map.of("reasons", check.reasons(k))));
                continue;
            }
            findings.addAll(normalized.findings());
            merged.put(k, normalized.section());
            regenerated.add(k);
        }
    }
}
