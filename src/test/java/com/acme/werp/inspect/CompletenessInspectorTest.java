package com.acme.werp.inspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.acme.werp.TestRecords;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Enums.Severity;
import com.acme.werp.record.RawRecordReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompletenessInspectorTest {

    private final RawRecordReader reader = new RawRecordReader();
    private final CompletenessInspector inspector = new CompletenessInspector(Placeholders.defaults());

    @Mock
    private SectionCheck failingCheck;

    private InspectionResult inspect(ObjectNode doc) {
        return inspector.inspect(reader.read(doc));
    }

    @Test
    void placeholderMatchingIsExactAfterTrimAndCase() {
        Placeholders p = Placeholders.defaults();

        assertThat(p.isPlaceholder("Insufficient data.")).isTrue();
        assertThat(p.isPlaceholder("INSUFFICIENT DATA.")).isTrue();
        assertThat(p.isPlaceholder("")).isTrue();
        assertThat(p.isPlaceholder(null)).isTrue();
        assertThat(p.isPlaceholder("  Not specified. ")).isTrue();
        assertThat(p.isPlaceholder("Insufficient data on hull thickness.")).isFalse();
    }

    @Test
    void completeRecordHasNoIncompleteSections() {
        InspectionResult r = inspect(TestRecords.complete());

        assertThat(r.complete()).isTrue();
        assertThat(r.reasons()).isEmpty();
    }

    @Test
    void legacyPollutionIsOutdatedAndMissingWeights() {
        InspectionResult r = inspect(TestRecords.messy());

        assertThat(r.incompleteSections()).contains(SectionKind.POLLUTION).doesNotContain(SectionKind.HULL);
        assertThat(r.reasons(SectionKind.POLLUTION)).containsExactly(
                ReasonCode.SCHEMA_VERSION_OUTDATED, ReasonCode.PARAMETER_COUNT,
                ReasonCode.WEIGHT_MISSING, ReasonCode.TOTAL_NOT_FINITE);
    }

    @Test
    void hullIsNeverIncompleteEvenWhenAbsent() {
        ObjectNode doc = TestRecords.complete();
        doc.remove("wcs");

        assertThat(inspect(doc).incomplete(SectionKind.HULL)).isFalse();
    }

    @Test
    void missingSectionIsReported() {
        ObjectNode doc = TestRecords.complete();
        doc.remove("esi");

        assertThat(inspect(doc).reasons(SectionKind.SENSITIVITY)).containsExactly(ReasonCode.SECTION_MISSING);
    }

    @Test
    void twoPlaceholderRationalesMakeSensitivityIncomplete() {
        ObjectNode doc = TestRecords.complete();
        ArrayNode params = (ArrayNode) doc.path("esi").path("parameters");
        ((ObjectNode) params.get(0)).put("rationale", "Insufficient data.");
        InspectionResult one = inspect(doc);
        ((ObjectNode) params.get(1)).put("rationale", "UNKNOWN.");
        InspectionResult two = inspect(doc);

        assertThat(one.incomplete(SectionKind.SENSITIVITY)).isFalse();
        assertThat(two.reasons(SectionKind.SENSITIVITY)).containsExactly(ReasonCode.PLACEHOLDER_RATIONALES);
    }

    @Test
    void renamedSensitivityParameterIsARequiredNameMiss() {
        ObjectNode doc = TestRecords.complete();
        ((ObjectNode) doc.path("esi").path("parameters").get(2)).put("name", "Marine Park");

        assertThat(inspect(doc).reasons(SectionKind.SENSITIVITY)).containsExactly(ReasonCode.REQUIRED_NAME_MISSING);
    }

    @Test
    void pressureAtBaselineEverywhereIsIncomplete() {
        ObjectNode doc = TestRecords.complete();
        for (var f : doc.path("rpm").path("factors")) ((ObjectNode) f).put("value", 1.04);
        ((ObjectNode) doc.get("rpm")).put("finalMultiplier", 1.04);

        assertThat(inspect(doc).reasons(SectionKind.PRESSURE)).containsExactly(ReasonCode.ALL_BASELINE_VALUES);
    }

    @Test
    void pressureMultiplierOutsideLegalRange() {
        ObjectNode doc = TestRecords.complete();
        ((ObjectNode) doc.get("rpm")).put("finalMultiplier", 3.2);

        assertThat(inspect(doc).reasons(SectionKind.PRESSURE)).containsExactly(ReasonCode.MULTIPLIER_OUT_OF_RANGE);
    }

    @Test
    void roleCappedPressureNeedsOnlyItsThreeRoles() {
        ObjectNode doc = TestRecords.complete();
        doc.set("rpm", TestRecords.json("""
                {"schemaVersion": 1, "finalMultiplier": 1.5, "factors": [
                  {"name": "Thermal Stress", "role": "thermal", "value": 1.3, "rationale": "Warming."},
                  {"name": "Physical Disturbance", "role": "physical", "value": 1.1, "rationale": "Storms."},
                  {"name": "Chemical Exposure", "role": "chemical", "value": 1.1, "rationale": "Acidification."}
                ]}
                """));

        assertThat(inspect(doc).incomplete(SectionKind.PRESSURE)).isFalse();
    }

    @Test
    void failingCheckMarksItsSectionAndKeepsGoing() throws Exception {
        when(failingCheck.section()).thenReturn(SectionKind.SENSITIVITY);
        doThrow(new IllegalArgumentException("boom")).when(failingCheck).run(any(), any(), any());
        CompletenessInspector withFailure = new CompletenessInspector(Placeholders.defaults(),
                List.of(failingCheck, new PollutionCompletenessCheck()));

        InspectionResult r = withFailure.inspect(reader.read(TestRecords.messy()));

        assertThat(r.reasons(SectionKind.SENSITIVITY)).containsExactly(ReasonCode.CHECK_FAILED);
        assertThat(r.incomplete(SectionKind.POLLUTION)).isTrue();
        assertThat(r.findings()).singleElement().extracting(f -> f.severity()).isEqualTo(Severity.WARN);
    }
}
