package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.record.RawSection;

/** Hull is always synthesized by the normalizer, so it is never reported incomplete. */
public final class HullCompletenessCheck implements SectionCheck {
    @Override public SectionKind section() { return SectionKind.HULL; }

    @Override
    public void run(RawSection raw, Placeholders placeholders, InspectionResultBuilder out) {}
}
