package com.pacaccounting.utils;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class UtilsTest {

    @Test
    void testRemoveDiacritics() {
        assertThat(Utils.removeDiacritics("Gonçalves Palhão")).isEqualTo("Goncalves Palhao");
        assertThat(Utils.removeDiacritics("Straße Øster")).isEqualTo("Strasse Oster");
        assertThat(Utils.removeDiacritics(null)).isEmpty();
    }

    @Test
    void testFormatMinutes() {
        assertThat(Utils.formatMinutes(150)).isEqualTo("2h30m");
        assertThat(Utils.formatMinutes(5)).isEqualTo("0h05m");
        assertThat(Utils.formatMinutes(-10)).isEqualTo("0h00m");
    }

    @Test
    void testJaroWinkler() {
        assertThat(Utils.jaroWinkler("ACME LDA", "ACME LDA")).isEqualTo(1.0);
        assertThat(Utils.jaroWinkler("ACME LDA", "ACMME LDA")).isGreaterThan(0.9);
        assertThat(Utils.jaroWinkler(null, "ACME")).isEqualTo(0.0);
    }

    @Test
    void testSaturatedSum() {
        assertThat(Utils.saturatedSum(30, 45)).isEqualTo(75);
        assertThat(Utils.saturatedSum(Integer.MAX_VALUE, 1)).isEqualTo(Integer.MAX_VALUE);
        assertThat(Utils.saturatedSum(Integer.MAX_VALUE, Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }
}
