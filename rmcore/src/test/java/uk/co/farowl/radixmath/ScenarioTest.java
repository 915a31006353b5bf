// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Small end-to-end uses of the decimal arithmetic, each through the
 * dispatching facade as a client would call it.
 */
@DisplayName("The decimal arithmetic")
class ScenarioTest extends UnitTestSupport {

    @Test
    @DisplayName("adds exactly without a context")
    void addWithoutContext() {
        DecimalNumber r = MATH.add(dec("1"), dec("2"), null);
        assertNumber("3", r);
    }

    @Test
    @DisplayName("rounds 1/3 to five digits")
    void divideRounded() {
        PrecisionContext ctx = context(5);
        DecimalNumber r = MATH.divide(dec("1"), dec("3"), ctx);
        assertNumber("0.33333", r);
        assertFlags(ctx, Flag.INEXACT, Flag.ROUNDED);
    }

    @Test
    @DisplayName("divides by zero to infinity")
    void divideByZero() {
        PrecisionContext ctx = context(5);
        DecimalNumber r = MATH.divide(dec("1"), dec("0"), ctx);
        assertNumber("Infinity", r);
        assertFlags(ctx, Flag.DIVIDE_BY_ZERO);
    }

    @Test
    @DisplayName("compares with a quiet NaN silently")
    void compareQuietNaN() {
        PrecisionContext ctx = context(5);
        DecimalNumber r =
                MATH.compareToWithContext(dec("NaN"), dec("1"), false, ctx);
        assertTrue(r.isNaN());
        assertTrue(ctx.getFlags().isEmpty());
    }

    @Test
    @DisplayName("compares with a quiet NaN as signaling on request")
    void compareQuietNaNAsSignaling() {
        PrecisionContext ctx = context(5);
        DecimalNumber r =
                MATH.compareToWithContext(dec("NaN"), dec("1"), true, ctx);
        assertTrue(r.isNaN());
        assertFlags(ctx, Flag.INVALID);
    }

    @Test
    @DisplayName("quantizes 1.23 to 1.000")
    void quantize() {
        PrecisionContext ctx = context(10);
        DecimalNumber r = MATH.quantize(dec("1.23"), dec("1.000"), ctx);
        assertNumber("1.230", r);
        assertTrue(ctx.getFlags().isEmpty());
    }

    @Test
    @DisplayName("refuses pi without a context")
    void piWithoutContext() {
        NullPointerException e = assertThrows(NullPointerException.class,
                () -> MATH.pi(null));
        assertEquals("pi requires a precision context", e.getMessage());
    }

    @Test
    @DisplayName("gives NaN for pi at unlimited precision")
    void piUnlimited() {
        PrecisionContext ctx = context(0);
        DecimalNumber r = MATH.pi(ctx);
        assertTrue(r.isNaN());
        assertFlags(ctx, Flag.INVALID);
    }
}
