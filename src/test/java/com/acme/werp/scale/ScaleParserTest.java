package com.acme.werp.scale;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class ScaleParserTest {

    @Test
    void readsPlainNumbersAndNumericStrings() {
        assertThat(ScaleParser.parse(3)).isEqualTo(ParsedValue.of(3.0));
        assertThat(ScaleParser.parse(" 12.5 ")).isEqualTo(ParsedValue.of(12.5));
        assertThat(ScaleParser.parse(IntNode.valueOf(7))).isEqualTo(ParsedValue.of(7.0));
        assertThat(ScaleParser.parse(TextNode.valueOf("4"))).isEqualTo(ParsedValue.of(4.0));
    }

    @Test
    void trailingPercentSignMarksPercentUnits() {
        ParsedValue v = ScaleParser.parse("45%");

        assertThat(v.isPresent()).isTrue();
        assertThat(v.percent()).isTrue();
        assertThat(v.value()).isEqualTo(45.0);
    }

    @Test
    void weightKeysAboveOnePointFiveAreReadAsPercent() {
        assertThat(ScaleParser.parse(50, "weight").percent()).isTrue();
        assertThat(ScaleParser.parse(50, "weightPct").percent()).isTrue();
        assertThat(ScaleParser.parse(0.5, "weight").percent()).isFalse();
        assertThat(ScaleParser.parse(1.5, "weight").percent()).isFalse();
        assertThat(ScaleParser.parse(50, "score").percent()).isFalse();
    }

    @Test
    void unreadableInputIsAbsentRatherThanAnError() {
        assertThat(ScaleParser.parse(null).isPresent()).isFalse();
        assertThat(ScaleParser.parse("").isPresent()).isFalse();
        assertThat(ScaleParser.parse("%").isPresent()).isFalse();
        assertThat(ScaleParser.parse("high").isPresent()).isFalse();
        assertThat(ScaleParser.parse(Double.NaN).isPresent()).isFalse();
        assertThat(ScaleParser.parse(NullNode.getInstance()).isPresent()).isFalse();
        assertThat(ScaleParser.parse(ParsedValue.ABSENT.orElse(2.0))).isEqualTo(ParsedValue.of(2.0));
    }
}
