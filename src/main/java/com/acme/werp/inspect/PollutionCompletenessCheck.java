package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.PollutionSection;
import com.acme.werp.normalize.CanonicalSchemas;
import com.acme.werp.record.RawSection;

public final class PollutionCompletenessCheck implements SectionCheck {
    @Override public SectionKind section() { return SectionKind.POLLUTION; }

    @Override
    public void run(RawSection raw, Placeholders placeholders, InspectionResultBuilder out) {
        SectionKind k = section();
        if (!raw.present()) { out.addReason(k, ReasonCode.SECTION_MISSING); return; }

        if (raw.schemaVersion() == null || raw.schemaVersion() != PollutionSection.CURRENT_VERSION) {
            out.addReason(k, ReasonCode.SCHEMA_VERSION_OUTDATED);
        }
        if (raw.items().size() != CanonicalSchemas.POLLUTION_V3.size()) out.addReason(k, ReasonCode.PARAMETER_COUNT);
        if (!NameChecks.allPresent(raw.items(), CanonicalSchemas.names(CanonicalSchemas.POLLUTION_V3))) {
            out.addReason(k, ReasonCode.REQUIRED_NAME_MISSING);
        }
        if (raw.items().stream().anyMatch(p -> !p.hasWeight())) out.addReason(k, ReasonCode.WEIGHT_MISSING);
        if (!raw.total().isPresent()) out.addReason(k, ReasonCode.TOTAL_NOT_FINITE);
    }
}
