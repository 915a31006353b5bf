// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Long arithmetic for the fast paths")
class LongArithmeticTest {

    @ParameterizedTest(name = "radix {0}")
    @ValueSource(ints = {2, 3, 7, 10, 16, 36})
    @DisplayName("tabulates every power that fits")
    void powers(int radix) {
        BigInteger r = BigInteger.valueOf(radix);
        int n = 0;
        for (; LongArithmetic.pow(radix, n) >= 0; n++) {
            assertEquals(r.pow(n).longValueExact(),
                    LongArithmetic.pow(radix, n));
        }
        // The first missing power does not fit
        assertTrue(r.pow(n).bitLength() > 63);
    }

    @Test
    @DisplayName("counts digits")
    void digits() {
        assertEquals(1, LongArithmetic.digits(0L, 10));
        assertEquals(1, LongArithmetic.digits(9L, 10));
        assertEquals(2, LongArithmetic.digits(10L, 10));
        assertEquals(19, LongArithmetic.digits(Long.MAX_VALUE, 10));
        assertEquals(63, LongArithmetic.digits(Long.MAX_VALUE, 2));
        assertEquals(3, LongArithmetic.digits(0xfffL, 16));
    }

    @Test
    @DisplayName("detects an overflowing sum")
    void sumFits() {
        assertTrue(LongArithmetic.sumFits(Long.MAX_VALUE, -1L));
        assertTrue(LongArithmetic.sumFits(Long.MAX_VALUE, Long.MIN_VALUE));
        assertFalse(LongArithmetic.sumFits(Long.MAX_VALUE, 1L));
        assertFalse(LongArithmetic.sumFits(Long.MIN_VALUE, -1L));
    }

    @Test
    @DisplayName("never admits an overflowing product")
    void productFits() {
        assertTrue(LongArithmetic.productFits(0L, Long.MIN_VALUE));
        assertTrue(LongArithmetic.productFits(1L << 30, 1L << 31));
        assertTrue(LongArithmetic.productFits(-(1L << 31), 1L << 30));
        assertFalse(LongArithmetic.productFits(1L << 32, 1L << 31));
        assertFalse(LongArithmetic.productFits(Long.MIN_VALUE, 1L));
        assertFalse(LongArithmetic.productFits(3_037_000_500L,
                3_037_000_500L));
    }
}
