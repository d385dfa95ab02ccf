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

import java.util.*;

public final class InspectionResultBuilder {
    private final Map<SectionKind, List<ReasonCode>> reasons = new EnumMap<>(SectionKind.class);
    private final List<Finding> findings = new ArrayList<>();

    public void addReason(SectionKind kind, ReasonCode reason) {
        List<ReasonCode> list = reasons.computeIfAbsent(kind, k -> new ArrayList<>());
        if (!list.contains(reason)) list.add(reason);
    }

    public void addFinding(Finding f) { if (f != null) findings.add(f); }

    public InspectionResult build() {
        Map<SectionKind, List<ReasonCode>> copy = new EnumMap<>(SectionKind.class);
        reasons.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        EnumSet<SectionKind> incomplete = copy.isEmpty() ? EnumSet.noneOf(SectionKind.class) : EnumSet.copyOf(copy.keySet());
        return new InspectionResult(Collections.unmodifiableSet(incomplete), Collections.unmodifiableMap(copy), List.copyOf(findings));
    }
}
