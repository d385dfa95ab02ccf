package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.normalize.CanonicalSchemas;
import com.acme.werp.record.RawSection;

public final class SensitivityCompletenessCheck implements SectionCheck {
    @Override public SectionKind section() { return SectionKind.SENSITIVITY; }

    @Override
    public void run(RawSection raw, Placeholders placeholders, InspectionResultBuilder out) {
        SectionKind k = section();
        if (!raw.present()) { out.addReason(k, ReasonCode.SECTION_MISSING); return; }

        if (raw.items().size() < CanonicalSchemas.SENSITIVITY.size()) out.addReason(k, ReasonCode.PARAMETER_COUNT);
        if (!NameChecks.allPresent(raw.items(), CanonicalSchemas.names(CanonicalSchemas.SENSITIVITY))) {
            out.addReason(k, ReasonCode.REQUIRED_NAME_MISSING);
        }
        if (placeholders.count(raw.items()) >= NameChecks.PLACEHOLDER_LIMIT) out.addReason(k, ReasonCode.PLACEHOLDER_RATIONALES);
        if (!raw.total().isPresent()) out.addReason(k, ReasonCode.TOTAL_NOT_FINITE);
    }
}
