// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("A precision context")
class PrecisionContextTest extends UnitTestSupport {

    @Nested
    @DisplayName("from a preset")
    class PresetTest {

        @Test
        @DisplayName("UNLIMITED has no limits and records nothing")
        void unlimited() {
            PrecisionContext c = PrecisionContext.UNLIMITED;
            assertFalse(c.hasMaxPrecision());
            assertFalse(c.hasExponentRange());
            assertFalse(c.hasFlags());
            assertTrue(c.getTraps().isEmpty());
            assertEquals(Rounding.HALF_EVEN, c.getRounding());
        }

        @Test
        @DisplayName("BASIC traps the serious conditions")
        void basic() {
            PrecisionContext c = PrecisionContext.BASIC;
            assertEquals(9, c.getPrecision());
            assertEquals(Rounding.HALF_UP, c.getRounding());
            assertEquals(BigInteger.valueOf(-999), c.getEMin());
            assertEquals(BigInteger.valueOf(999), c.getEMax());
            assertEquals(flags(Flag.INVALID, Flag.DIVIDE_BY_ZERO,
                    Flag.OVERFLOW, Flag.UNDERFLOW), c.getTraps());
            assertFalse(c.isTrapped(Flag.INEXACT));
        }

        @Test
        @DisplayName("DECIMAL64 is the IEEE interchange format")
        void decimal64() {
            PrecisionContext c = PrecisionContext.DECIMAL64;
            assertEquals(16, c.getPrecision());
            assertFalse(c.isPrecisionInBits());
            assertEquals(BigInteger.valueOf(-383), c.getEMin());
            assertEquals(BigInteger.valueOf(384), c.getEMax());
            assertTrue(c.isClampNormalExponents());
        }

        @Test
        @DisplayName("BINARY64 counts bits and does not clamp")
        void binary64() {
            PrecisionContext c = PrecisionContext.BINARY64;
            assertEquals(53, c.getPrecision());
            assertTrue(c.isPrecisionInBits());
            assertEquals(BigInteger.valueOf(-1022), c.getEMin());
            assertFalse(c.isClampNormalExponents());
        }
    }

    @Nested
    @DisplayName("when derived")
    class DeriveTest {

        @Test
        @DisplayName("changes only what is named")
        void derive() {
            PrecisionContext c = PrecisionContext.DECIMAL32
                    .withRounding(Rounding.FLOOR);
            assertEquals(7, c.getPrecision());
            assertEquals(Rounding.FLOOR, c.getRounding());
            assertEquals(BigInteger.valueOf(96), c.getEMax());
            assertEquals(Rounding.HALF_EVEN,
                    PrecisionContext.DECIMAL32.getRounding());
        }

        @Test
        @DisplayName("may lose its exponent range")
        void unlimitedExponents() {
            PrecisionContext c =
                    PrecisionContext.DECIMAL32.withUnlimitedExponents();
            assertFalse(c.hasExponentRange());
            assertNull(c.getEMin());
        }

        @Test
        @DisplayName("shares its accumulator across engines")
        void sharedFlags() {
            PrecisionContext c = context(5);
            PrecisionContext s = c.withSimplified(true);
            assertTrue(s.isSimplified());
            assertSame(c.getFlags(), s.getFlags());
            MATH.divide(dec("1"), dec("3"), s);
            assertTrue(c.getFlags().contains(Flag.INEXACT));
        }

        @Test
        @DisplayName("gets a new accumulator from withBlankFlags")
        void blankFlags() {
            PrecisionContext c = context(5);
            PrecisionContext d = c.withBlankFlags();
            assertNotSame(c.getFlags(), d.getFlags());
            assertFalse(d.withNoFlags().hasFlags());
        }

        @Test
        @DisplayName("describes itself")
        void describe() {
            String s = PrecisionContext.BASIC.toString();
            assertThat(s, containsString("precision=9"));
            assertThat(s, containsString("HALF_UP"));
        }
    }

    @Nested
    @DisplayName("rejects")
    class InvalidTest {

        @Test
        @DisplayName("a negative precision")
        void negativePrecision() {
            assertThrows(IllegalArgumentException.class,
                    () -> PrecisionContext.forPrecision(-1));
        }

        @Test
        @DisplayName("eMin greater than eMax")
        void exponentRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> PrecisionContext.forPrecision(9)
                            .withExponentRange(5, 1));
        }

        @Test
        @DisplayName("a null rounding mode")
        void nullRounding() {
            assertThrows(NullPointerException.class,
                    () -> PrecisionContext.forRounding(null));
        }
    }

    @Test
    @DisplayName("means unlimited when absent")
    void orDefault() {
        assertSame(PrecisionContext.UNLIMITED,
                PrecisionContext.orDefault(null));
        PrecisionContext c = context(3);
        assertSame(c, PrecisionContext.orDefault(c));
    }
}
