package com.acme.werp.regen;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.normalize.CanonicalSchemas;

import java.util.Set;
import java.util.StringJoiner;

public record RegenerationRequest(String recordId, String vesselName, String context, Set<SectionKind> sections) {

    public RegenerationRequest {
        sections = Set.copyOf(sections);
    }

    /** Plain request text; the section shapes are spelled out so the reply can be parsed back. */
    public String prompt() {
        StringJoiner j = new StringJoiner("\n");
        j.add("Reassess the shipwreck \"" + vesselName + "\".");
        if (context != null && !context.isBlank()) j.add(context);
        j.add("Return one JSON object with only these keys:");
        for (SectionKind k : SectionKind.values()) {
            if (!sections.contains(k)) continue;
            j.add(switch (k) {
                case HULL -> "- \"wcs\": {\"parameters\": [{\"name\", \"rationale\", \"score\" 0-5}] for "
                        + CanonicalSchemas.names(CanonicalSchemas.HULL);
                case POLLUTION -> "- \"phs\": {\"parameters\": [{\"name\", \"rationale\", \"score\" 0-10}] for "
                        + CanonicalSchemas.names(CanonicalSchemas.POLLUTION_V3);
                case SENSITIVITY -> "- \"esi\": {\"parameters\": [{\"name\", \"rationale\", \"score\" 0-10}] for "
                        + CanonicalSchemas.names(CanonicalSchemas.SENSITIVITY);
                case PRESSURE -> "- \"rpm\": {\"factors\": [{\"name\", \"rationale\", \"value\" 0.5-2.5}] for "
                        + CanonicalSchemas.names(CanonicalSchemas.PRESSURE_AVERAGED);
            });
        }
        j.add("Give a specific rationale for every entry.");
        return j.toString();
    }
}
