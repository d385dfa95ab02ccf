/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: WERP Risk Scoring Engine
 */

package com.acme.werp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public final class Enums {
    private Enums() {}

    public enum Severity { OK, WARN, ERROR }

    public enum Band {
        HIGH, MEDIUM, LOW, UNKNOWN;

        @JsonValue
        public String wire() { return name().toLowerCase(Locale.ROOT); }

        @JsonCreator
        public static Band fromWire(String s) {
            if (s == null) return UNKNOWN;
            try { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
            catch (IllegalArgumentException e) { return UNKNOWN; }
        }
    }

    /** The four sub-scales, with the key each one is stored under. */
    public enum SectionKind {
        HULL("wcs"), POLLUTION("phs"), SENSITIVITY("esi"), PRESSURE("rpm");

        private final String key;
        SectionKind(String key) { this.key = key; }
        public String key() { return key; }
    }

    public enum FactorRole {
        THERMAL(1.4), PHYSICAL(1.4), CHEMICAL(1.2);

        private final double cap;
        FactorRole(double cap) { this.cap = cap; }
        public double cap() { return cap; }

        @JsonValue
        public String wire() { return name().toLowerCase(Locale.ROOT); }

        public static FactorRole parse(String s) {
            if (s == null || s.isBlank()) return null;
            try { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
            catch (IllegalArgumentException e) { return null; }
        }
    }

    public enum BatchMode { NORMALIZE, REPAIR }
}
