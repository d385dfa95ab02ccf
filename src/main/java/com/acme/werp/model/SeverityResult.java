package com.acme.werp.model;

import com.acme.werp.model.Enums.Band;

/** value is null when it could not be computed; band is then UNKNOWN. */
public record SeverityResult(Double value, Band band) {
    public static final SeverityResult UNKNOWN = new SeverityResult(null, Band.UNKNOWN);

    public boolean known() { return value != null && band != Band.UNKNOWN; }
}
