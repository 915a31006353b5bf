// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.options;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("An option string")
class OptionsParserTest {

    @Test
    @DisplayName("has keys in any case")
    void keyCase() {
        OptionsParser p = new OptionsParser("Name=Value;other=x");
        assertTrue(p.has("name"));
        assertTrue(p.has("NAME"));
        assertFalse(p.has("missing"));
        assertEquals("Value", p.getString("nAmE", null));
        assertEquals("value", p.getLowerCaseString("name", null));
    }

    @Test
    @DisplayName("folds only ASCII letters in keys")
    void asciiFold() {
        // U+212A KELVIN SIGN and U+0130 LATIN CAPITAL I WITH DOT ABOVE
        OptionsParser p = new OptionsParser("\u212Aey=a;\u0130d=b;\u00C9=c");
        assertFalse(p.has("key"));
        assertTrue(p.has("\u212Aey"));
        assertFalse(p.has("id"));
        assertFalse(p.has("i\u0307d"));
        assertEquals("b", p.getString("\u0130D", null));
        assertFalse(p.has("\u00E9"));
        assertEquals("c", p.getString("\u00C9", null));
    }

    @Test
    @DisplayName("takes the last of repeated keys")
    void lastWins() {
        OptionsParser p = new OptionsParser("k=1;K=2;k=3");
        assertEquals("3", p.getString("k", null));
    }

    @Test
    @DisplayName("ignores tokens without a value")
    void junk() {
        OptionsParser p = new OptionsParser(";flag;;k=v;");
        assertFalse(p.has("flag"));
        assertEquals("v", p.getString("k", null));
    }

    @Test
    @DisplayName("splits a token at its first equals sign")
    void equalsInValue() {
        OptionsParser p = new OptionsParser("a=b=c;empty=");
        assertEquals("b=c", p.getString("a", null));
        assertEquals("", p.getString("empty", "default"));
    }

    @Test
    @DisplayName("supplies defaults")
    void defaults() {
        OptionsParser p = new OptionsParser("");
        assertNull(p.getString("k", null));
        assertEquals("d", p.getLowerCaseString("k", "d"));
        assertTrue(p.getBoolean("k", true));
    }

    @ParameterizedTest(name = "\"{0}\" is true")
    @ValueSource(strings = {"1", "true", "TRUE", "yes", "On"})
    @DisplayName("reads a true boolean")
    void booleanTrue(String v) {
        assertTrue(new OptionsParser("b=" + v).getBoolean("b", false));
    }

    @ParameterizedTest(name = "\"{0}\" is false")
    @ValueSource(strings = {"0", "false", "no", "off", "", "maybe"})
    @DisplayName("reads a false boolean")
    void booleanFalse(String v) {
        assertFalse(new OptionsParser("b=" + v).getBoolean("b", true));
    }

    @Test
    @DisplayName("may not be null")
    void nullOptions() {
        assertThrows(NullPointerException.class,
                () -> new OptionsParser(null));
    }
}
