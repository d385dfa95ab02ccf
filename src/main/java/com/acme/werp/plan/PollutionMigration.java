package com.acme.werp.plan;

import com.acme.werp.model.NormalizedSection;
import com.acme.werp.model.PollutionSection;
import com.acme.werp.normalize.PollutionNormalizer;
import com.acme.werp.record.RawSection;

/**
 * v2 to v3: "Vessel Integrity" is dropped, the three remaining parameters keep their scores and
 * rationales, and the fixed v3 weights replace whatever was stored.
 */
public final class PollutionMigration {
    private final PollutionNormalizer normalizer = new PollutionNormalizer();

    public NormalizedSection<PollutionSection> migrate(RawSection stored) {
        return normalizer.normalize(stored, PollutionSection.CURRENT_VERSION);
    }
}
