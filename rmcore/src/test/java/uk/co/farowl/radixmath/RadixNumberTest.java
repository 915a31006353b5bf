// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("A radix number")
class RadixNumberTest extends UnitTestSupport {

    @Nested
    @DisplayName("is ordered")
    class OrderTest {

        @Test
        @DisplayName("by value, ignoring exponent and the sign of zero")
        void byValue() {
            assertEquals(0, dec("1.0").compareTo(dec("1.00")));
            assertEquals(0, dec("-0").compareTo(dec("0E+5")));
            assertThat(dec("-1").compareTo(dec("-0.5")), lessThan(0));
            assertThat(dec("1E+3").compareTo(dec("999")), greaterThan(0));
        }

        @Test
        @DisplayName("with every NaN above Infinity")
        void nanLast() {
            assertThat(dec("NaN").compareTo(dec("Infinity")), greaterThan(0));
            assertThat(dec("-Infinity").compareTo(dec("-sNaN")),
                    lessThan(0));
            assertEquals(0, dec("NaN").compareTo(dec("sNaN3")));
        }

        @Test
        @DisplayName("so that a list sorts")
        void sort() {
            List<DecimalNumber> list = new ArrayList<>();
            for (String s : new String[] {"3", "NaN", "-Infinity", "0.5",
                    "-2", "Infinity"}) {
                list.add(dec(s));
            }
            Collections.sort(list);
            assertThat(list, contains(dec("-Infinity"), dec("-2"),
                    dec("0.5"), dec("3"), dec("Infinity"), dec("NaN")));
        }

        @Test
        @DisplayName("in binary too")
        void binary() {
            assertThat(BinaryNumber.fromDouble(0.5)
                    .compareTo(BinaryNumber.fromDouble(0.75)), lessThan(0));
            assertEquals(0, BinaryNumber.of(2, 0)
                    .compareTo(BinaryNumber.of(1, 1)));
        }
    }

    @Nested
    @DisplayName("is equal to another")
    class EqualityTest {

        @Test
        @DisplayName("only with the same representation")
        void structural() {
            assertEquals(dec("1.20"), dec("1.20"));
            assertEquals(dec("1.20").hashCode(), dec("1.20").hashCode());
            assertNotEquals(dec("1.2"), dec("1.20"));
            assertNotEquals(dec("0"), dec("-0"));
            assertFalse(dec("1").equals(BinaryNumber.of(1, 0)));
        }

        @Test
        @DisplayName("whatever the parts of an infinity")
        void infinity() {
            DecimalNumber inf = MATH.getRepresentation().create(false,
                    BigInteger.TEN, BigInteger.ONE, NumberKind.INFINITY);
            assertEquals(dec("Infinity"), inf);
            assertEquals(BigInteger.ZERO, inf.getMantissa());
        }
    }

    @Test
    @DisplayName("has a non-negative mantissa")
    void negativeMantissa() {
        assertThrows(IllegalArgumentException.class,
                () -> MATH.getRepresentation().finite(false,
                        BigInteger.valueOf(-1), BigInteger.ZERO));
    }

    @Test
    @DisplayName("knows its kind")
    void kind() {
        assertTrue(dec("0E-3").isZero());
        assertTrue(dec("-Inf").isInfinite());
        assertTrue(dec("sNaN").isNaN());
        assertEquals(NumberKind.SIGNALING_NAN, dec("sNaN").getKind());
        assertFalse(dec("NaN").isFinite());
        assertEquals(10, dec("1").radix());
        assertEquals(2, BinaryNumber.of(1, 0).radix());
    }
}
