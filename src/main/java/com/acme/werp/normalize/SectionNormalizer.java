package com.acme.werp.normalize;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.NormalizedSection;
import com.acme.werp.record.RawSection;

public interface SectionNormalizer<S> {
    SectionKind kind();
    NormalizedSection<S> normalize(RawSection raw);
}
