/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: WERP Risk Scoring Engine
 */

package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;
import com.acme.werp.record.RawRecord;
import com.acme.werp.record.RawSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** Runs every section check against the stored form of a record. */
public final class CompletenessInspector {
    private static final Logger logger = LoggerFactory.getLogger(CompletenessInspector.class);

    private final Placeholders placeholders;
    private final List<SectionCheck> checks;

    public CompletenessInspector(Placeholders placeholders) {
        this(placeholders, List.of(
                new HullCompletenessCheck(),
                new PollutionCompletenessCheck(),
                new SensitivityCompletenessCheck(),
                new PressureCompletenessCheck()
        ));
    }

    public CompletenessInspector(Placeholders placeholders, List<SectionCheck> checks) {
        this.placeholders = placeholders;
        this.checks = List.copyOf(checks);
    }

    public Placeholders placeholders() { return placeholders; }

    public InspectionResult inspect(RawRecord raw) {
        InspectionResultBuilder builder = new InspectionResultBuilder();
        for (SectionCheck c : checks) runCheck(c, raw.section(c.section()), builder);
        InspectionResult result = builder.build();
        if (!result.complete()) logger.debug("Record {} incomplete: {}", raw.id(), result.reasons());
        return result;
    }

    /** Inspects one section on its own, e.g. a freshly regenerated candidate. */
    public InspectionResult inspect(RawSection section) {
        InspectionResultBuilder builder = new InspectionResultBuilder();
        for (SectionCheck c : checks) {
            if (c.section() == section.kind()) runCheck(c, section, builder);
        }
        return builder.build();
    }

    private void runCheck(SectionCheck c, RawSection section, InspectionResultBuilder builder) {
        try { c.run(section, placeholders, builder); }
        catch (Exception e) {
            logger.warn("Completeness check for {} failed: {}", c.section(), e.getMessage());
            builder.addReason(c.section(), ReasonCode.CHECK_FAILED);
            builder.addFinding(Finding.warn("CHECKS", "Check '" + c.section().key() + "' failed: " + e.getMessage(),
                    Map.of("check", c.section().key())));
        }
    }
}
