package com.creditdesk.service.profitability;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocalizedNumberParserTest {

    @Test
    void parsesFrenchFormattedAmounts() {
        assertThat(LocalizedNumberParser.parse("200 000 €")).isEqualTo(200_000.0);
        assertThat(LocalizedNumberParser.parse("200 000")).isEqualTo(200_000.0);
        assertThat(LocalizedNumberParser.parse("1 250,50 EUR")).isEqualTo(1_250.5);
    }

    @Test
    void commaIsTheDecimalMark() {
        assertThat(LocalizedNumberParser.parse("8,5 %")).isEqualTo(8.5);
        assertThat(LocalizedNumberParser.parse("1.250,75")).isEqualTo(1_250.75);
        assertThat(LocalizedNumberParser.parse("12.5")).isEqualTo(12.5);
    }

    @Test
    void malformedInputReadsAsZero() {
        assertThat(LocalizedNumberParser.parse(null)).isZero();
        assertThat(LocalizedNumberParser.parse("")).isZero();
        assertThat(LocalizedNumberParser.parse("   ")).isZero();
        assertThat(LocalizedNumberParser.parse("abc")).isZero();
        assertThat(LocalizedNumberParser.parse("Infinity")).isZero();
        assertThat(LocalizedNumberParser.parse("NaN")).isZero();
    }

    @Test
    void readsTheLeadingNumberAndIgnoresTrailingText() {
        assertThat(LocalizedNumberParser.parse("12abc")).isEqualTo(12.0);
        assertThat(LocalizedNumberParser.parse("85 m²")).isEqualTo(85.0);
        assertThat(LocalizedNumberParser.parse("12,3,4")).isEqualTo(12.3);
        assertThat(LocalizedNumberParser.parse(",5")).isEqualTo(0.5);
    }

    @Test
    void rejectsJavaOnlyNumberLiterals() {
        assertThat(LocalizedNumberParser.parse("12d")).isEqualTo(12.0);
        assertThat(LocalizedNumberParser.parse("12f")).isEqualTo(12.0);
        assertThat(LocalizedNumberParser.parse("0x1p3")).isZero();
        assertThat(LocalizedNumberParser.parse("1e3")).isEqualTo(1.0);
    }

    @Test
    void keepsSign() {
        assertThat(LocalizedNumberParser.parse("-1 500")).isEqualTo(-1_500.0);
        assertThat(LocalizedNumberParser.parse("+2,5")).isEqualTo(2.5);
    }
}
