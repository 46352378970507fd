package com.di.modelnova.lifecycle.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SemanticVersion Tests")
class SemanticVersionTest {

    @Test
    @DisplayName("Should parse and print major.minor.patch")
    void testParse() {
        SemanticVersion v = SemanticVersion.parse(" 2.10.3 ");
        assertEquals(2, v.getMajor());
        assertEquals(10, v.getMinor());
        assertEquals(3, v.getPatch());
        assertEquals("2.10.3", v.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1.0", "1.0.0.0", "v1.0.0", "1.a.0", "99999999999.0.0"})
    @DisplayName("Should reject malformed versions")
    void testParse_Invalid(String text) {
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse(text));
    }

    @Test
    @DisplayName("Should compare numerically, not lexically")
    void testCompare() {
        assertTrue(SemanticVersion.parse("1.0.10").compareTo(SemanticVersion.parse("1.0.9")) > 0);
        assertTrue(SemanticVersion.parse("2.0.0").compareTo(SemanticVersion.parse("1.99.99")) > 0);
        assertEquals(0, SemanticVersion.parse("1.2.3").compareTo(SemanticVersion.parse("1.2.3")));
    }

    @Test
    @DisplayName("Should bump the patch component")
    void testNextPatch() {
        assertEquals("1.0.1", SemanticVersion.INITIAL.nextPatch().toString());
    }
}
