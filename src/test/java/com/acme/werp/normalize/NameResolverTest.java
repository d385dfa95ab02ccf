package com.acme.werp.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.werp.record.RawParameter;
import com.acme.werp.scale.ParsedValue;
import java.util.List;
import org.junit.jupiter.api.Test;

class NameResolverTest {

    private static RawParameter p(int i, String name, String rationale) {
        return new RawParameter(i, name, rationale, ParsedValue.of(1), ParsedValue.ABSENT, null);
    }

    private static RawParameter factor(int i, String name, String role) {
        return new RawParameter(i, name, "x", ParsedValue.of(1.1), ParsedValue.ABSENT, role);
    }

    @Test
    void exactNamesMatchIgnoringCaseAndWhitespace() {
        RawParameter age = p(0, "  age ", null);

        RawParameter[] r = NameResolver.resolve(List.of(age), CanonicalSchemas.HULL);

        assertThat(r[0]).isSameAs(age);
        assertThat(NameResolver.matched(r)).isEqualTo(1);
    }

    @Test
    void keywordsInNameOrRationaleSelectTheSlot() {
        RawParameter years = p(0, "Years Submerged", "On the seabed.");
        RawParameter corrosion = p(1, "hull corrosion", "");
        RawParameter byRationale = p(2, "Event", "Struck by a torpedo.");

        RawParameter[] r = NameResolver.resolve(List.of(years, corrosion, byRationale), CanonicalSchemas.HULL);

        assertThat(r[0]).isSameAs(years);
        assertThat(r[1]).isNull();
        assertThat(r[2]).isSameAs(byRationale);
        assertThat(r[3]).isSameAs(corrosion);
    }

    @Test
    void firstSeenCandidateKeepsTheSlotOnEqualScore() {
        RawParameter first = p(0, "Age of wreck", null);
        RawParameter second = p(1, "Years underwater", null);

        RawParameter[] r = NameResolver.resolve(List.of(first, second), CanonicalSchemas.HULL);

        assertThat(r[0]).isSameAs(first);
    }

    @Test
    void candidateOutscoredForOneSlotFallsBackToItsNextMatch() {
        RawParameter construction = p(0, "Construction integrity", "Hull integrity is poor.");
        RawParameter integrity = p(1, "Integrity and corrosion", "Plates thinning.");

        RawParameter[] r = NameResolver.resolve(List.of(construction, integrity), CanonicalSchemas.HULL);

        assertThat(r[3]).isSameAs(integrity);
        assertThat(r[1]).isSameAs(construction);
        assertThat(NameResolver.matched(r)).isEqualTo(2);
    }

    @Test
    void exactMatchBeatsAnEarlierKeywordMatch() {
        RawParameter keyword = p(0, "Ordnance cargo", null);
        RawParameter exact = p(1, "Ordnance", null);

        RawParameter[] r = NameResolver.resolve(List.of(keyword, exact), CanonicalSchemas.POLLUTION_V3);

        assertThat(r[1]).isSameAs(exact);
    }

    @Test
    void roleCappedFactorsMatchByRoleFirst() {
        RawParameter chem = factor(0, "Heat", "chemical");

        RawParameter[] r = NameResolver.resolve(List.of(chem), CanonicalSchemas.PRESSURE_ROLE_CAPPED);

        assertThat(r[2]).isSameAs(chem);
        assertThat(r[0]).isNull();
    }

    @Test
    void unrelatedNamesStayUnmatched() {
        RawParameter[] r = NameResolver.resolve(List.of(p(0, "Colour", "Blue paint.")), CanonicalSchemas.SENSITIVITY);

        assertThat(NameResolver.matched(r)).isZero();
    }
}
