// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.options;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JSON options")
class JsonOptionsTest {

    @Test
    @DisplayName("default sensibly")
    void defaults() {
        JsonOptions o = JsonOptions.DEFAULT;
        assertFalse(o.isAllowDuplicateKeys());
        assertFalse(o.isBase64Padding());
        assertFalse(o.isReplaceSurrogates());
        assertSame(NumberConversion.FULL, o.getNumberConversion());
    }

    @Test
    @DisplayName("pad base64 when parsed without that key")
    void parsedDefaults() {
        JsonOptions o = new JsonOptions("");
        assertFalse(o.isAllowDuplicateKeys());
        assertTrue(o.isBase64Padding());
        assertFalse(o.isReplaceSurrogates());
        assertSame(NumberConversion.FULL, o.getNumberConversion());
    }

    @Test
    @DisplayName("read keys and values in any case")
    void parse() {
        JsonOptions o = new JsonOptions(
                "AllowDuplicateKeys=TRUE;numberConversion=IntOrFloat");
        assertTrue(o.isAllowDuplicateKeys());
        assertSame(NumberConversion.INT_OR_FLOAT, o.getNumberConversion());
    }

    @Test
    @DisplayName("take the last of a repeated key")
    void repeated() {
        JsonOptions o =
                new JsonOptions("base64padding=false;base64padding=yes");
        assertTrue(o.isBase64Padding());
    }

    @Test
    @DisplayName("ignore what they do not understand")
    void unknown() {
        JsonOptions o = new JsonOptions(
                "junk;colour=blue;replacesurrogates=on;numberconversion=x");
        assertTrue(o.isReplaceSurrogates());
        assertSame(NumberConversion.FULL, o.getNumberConversion());
    }

    @Test
    @DisplayName("write an option string")
    void write() {
        assertEquals("base64padding=false;replacesurrogates=false;"
                + "numberconversion=full;allowduplicatekeys=false",
                JsonOptions.DEFAULT.toString());
        JsonOptions o = new JsonOptions(
                "numberconversion=double;base64padding=0");
        assertEquals("base64padding=false;replacesurrogates=false;"
                + "numberconversion=double;allowduplicatekeys=false",
                o.toString());
    }

    @Test
    @DisplayName("do not match keys folded outside ASCII")
    void kelvinSign() {
        // U+212A KELVIN SIGN lower-cases to 'k' in Unicode
        JsonOptions o = new JsonOptions("allowduplicate\u212Aeys=true");
        assertFalse(o.isAllowDuplicateKeys());
    }

    @Test
    @DisplayName("read back what they write")
    void roundTrip() {
        JsonOptions o = new JsonOptions("allowduplicatekeys=1;"
                + "replacesurrogates=1;numberconversion=intorfloatfromdouble");
        JsonOptions p = new JsonOptions(o.toString());
        assertEquals(o.toString(), p.toString());
        assertSame(NumberConversion.INT_OR_FLOAT_FROM_DOUBLE,
                p.getNumberConversion());
    }

    @Test
    @DisplayName("may not be null")
    void nullOptions() {
        assertThrows(NullPointerException.class, () -> new JsonOptions(null));
    }
}
