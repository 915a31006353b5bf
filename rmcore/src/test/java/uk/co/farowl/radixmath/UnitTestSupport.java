// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.function.Executable;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs.
 */
public class UnitTestSupport {

    /** The decimal arithmetic under test. */
    protected static final DispatchingRadixMath<DecimalNumber> MATH =
            DecimalNumber.MATH;

    /**
     * A context of nine digits, rounding half-even, with the exponent
     * range of the General Decimal Arithmetic examples.
     */
    protected static final PrecisionContext NINE =
            PrecisionContext.forPrecision(9).withExponentRange(-383, 384);

    /**
     * Parse a decimal test value.
     *
     * @param s text form
     * @return the number
     */
    public static DecimalNumber dec(String s) {
        return DecimalNumber.fromString(s);
    }

    /**
     * A context with the given precision that records flags.
     *
     * @param precision in digits
     * @return new context
     */
    public static PrecisionContext context(int precision) {
        return PrecisionContext.forPrecision(precision).withBlankFlags();
    }

    /**
     * A copy of a context with a new, empty flag accumulator, and
     * either engine.
     *
     * @param ctx model context
     * @param simplified whether to select the simplified engine
     * @return new context
     */
    public static PrecisionContext fresh(PrecisionContext ctx,
            boolean simplified) {
        return ctx.withSimplified(simplified).withBlankFlags();
    }

    /**
     * Build a set of flags.
     *
     * @param flags to include
     * @return the set
     */
    public static Set<Flag> flags(Flag... flags) {
        EnumSet<Flag> set = EnumSet.noneOf(Flag.class);
        for (Flag f : flags) { set.add(f); }
        return set;
    }

    /**
     * The number has exactly the expected text form, which (since the
     * text form shows the exponent) is stronger than numerical
     * equality.
     *
     * @param expected text form
     * @param actual number
     */
    public static void assertNumber(String expected,
            RadixNumber<?> actual) {
        assertEquals(expected, actual.toString());
    }

    /**
     * The context has recorded exactly the expected flags.
     *
     * @param ctx context with an accumulator
     * @param expected flags
     */
    public static void assertFlags(PrecisionContext ctx, Flag... expected) {
        assertEquals(flags(expected), ctx.getFlags().toSet());
    }

    /**
     * Invoke an action expected to trap and check the condition. The
     * return value may be the subject of further assertions.
     *
     * @param expected condition named by the exception
     * @param action to invoke
     * @return the exception thrown
     */
    public static TrapException assertTraps(Flag expected,
            Executable action) {
        TrapException e = assertThrows(TrapException.class, action);
        assertEquals(expected, e.getFlag());
        return e;
    }
}
