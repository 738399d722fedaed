package com.stattools.formula.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameNormalizerTest {

    private static final Pattern CANONICAL = Pattern.compile("^[a-z0-9]+(_[a-z0-9]+)*$");

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "mass (g)|mass_g",
            "Mass (g)|mass_g",
            "mass_g|mass_g",
            "Growth %|growth_percent",
            "Driver's Age|drivers_age",
            "  reclat  |reclat",
            "__GeoLocation__|geolocation",
            "a---b___c|a_b_c",
            "Year|year",
            "x1|x1"
    })
    void normalize_mapsRawNamesToCanonical(String raw, String expected) {
        assertEquals(expected, NameNormalizer.normalize(raw));
    }

    @Test
    void normalize_nullAndSymbolsOnlyYieldEmpty() {
        assertEquals("", NameNormalizer.normalize(null));
        assertEquals("", NameNormalizer.normalize(""));
        assertEquals("", NameNormalizer.normalize("()"));
        assertEquals("", NameNormalizer.normalize(" - "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"mass (g)", "Growth %", "Ünïcödé Name", "  __a__b__  ", "it's 100%!", "A.B.C", "ID", "x", "%", "'"})
    void normalize_isIdempotentAndCanonical(String raw) {
        String once = NameNormalizer.normalize(raw);
        assertEquals(once, NameNormalizer.normalize(once));
        assertTrue(once.isEmpty() || CANONICAL.matcher(once).matches(), () -> "not canonical: " + once);
    }
}
