package com.acme.werp.plan;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;
import com.acme.werp.model.SeverityResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level fields to merge into a stored record. Sections not listed here are left as stored.
 * failed holds sections whose regeneration was rejected; pending holds those a dry run skipped.
 */
public record RecordPatch(
        String id,
        Map<SectionKind, Object> sections,
        SeverityResult severity,
        Instant updatedAt,
        Set<SectionKind> regenerated,
        Set<SectionKind> recomputed,
        Set<SectionKind> failed,
        Set<SectionKind> pending,
        boolean ageRescored,
        List<Finding> findings
) {
    public boolean isEmpty() { return sections.isEmpty() && severity == null; }

    public boolean wouldChange() { return !isEmpty(); }

    public boolean hasFailures() { return !failed.isEmpty(); }

    public ObjectNode toUpdate(ObjectMapper mapper) {
        ObjectNode update = mapper.createObjectNode();
        for (SectionKind k : SectionKind.values()) {
            Object section = sections.get(k);
            if (section != null) update.set(k.key(), mapper.valueToTree(section));
        }
        if (severity != null) update.set("severity", mapper.valueToTree(severity));
        if (updatedAt != null && !isEmpty()) update.put("updatedAt", updatedAt.toString());
        return update;
    }

    /** Merge on top-level keys, the way the record store applies updates. */
    public static void applyTo(ObjectNode target, ObjectNode update) {
        update.fields().forEachRemaining(e -> target.set(e.getKey(), e.getValue().deepCopy()));
    }
}
