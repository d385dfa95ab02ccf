package com.acme.werp;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.werp.config.EngineConfig;
import com.acme.werp.model.Enums.Band;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.SeverityResult;
import com.acme.werp.plan.RecordPatch;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WerpEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void configuredThresholdsDriveTheBand() {
        WerpEngine strict = new WerpEngine(
                EngineConfig.from(Map.of(EngineConfig.SEVERITY_HIGH, "50", EngineConfig.SEVERITY_MEDIUM, "30")),
                CLOCK, TestRecords.MAPPER);

        SeverityResult severity = strict.normalize(TestRecords.complete()).assessment().severity();

        assertThat(severity.value()).isEqualTo(37.5);
        assertThat(severity.band()).isEqualTo(Band.MEDIUM);
    }

    @Test
    void configuredPlaceholdersDriveInspection() {
        ObjectNode doc = TestRecords.complete();
        doc.path("esi").path("parameters").forEach(p -> ((ObjectNode) p).put("rationale", "TBD"));
        WerpEngine defaults = new WerpEngine(EngineConfig.defaults(), CLOCK, TestRecords.MAPPER);
        WerpEngine custom = new WerpEngine(EngineConfig.from(Map.of(EngineConfig.PLACEHOLDERS, "|tbd")),
                CLOCK, TestRecords.MAPPER);

        assertThat(defaults.inspect(doc).complete()).isTrue();
        assertThat(custom.inspect(doc).incomplete(SectionKind.SENSITIVITY)).isTrue();
    }

    @Test
    void completeRecordNeedsNoRepair() {
        WerpEngine engine = new WerpEngine(EngineConfig.defaults(), CLOCK, TestRecords.MAPPER);
        ObjectNode doc = TestRecords.complete();
        doc.set("severity", TestRecords.MAPPER.valueToTree(new SeverityResult(37.5, Band.HIGH)));

        RecordPatch patch = engine.planAndApply(doc, null);

        assertThat(engine.plan(doc).isEmpty()).isTrue();
        assertThat(patch.isEmpty()).isTrue();
        assertThat(patch.toUpdate(TestRecords.MAPPER).isEmpty()).isTrue();
    }
}
