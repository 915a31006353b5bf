// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

/**
 * The exceptional conditions an arithmetic operation may signal. A
 * condition is always recorded in the flag accumulator of the context,
 * if it has one, and causes a {@link TrapException} if the context
 * traps it.
 * <p>
 * The declaration order is the priority order of traps: when several
 * trapped conditions arise in one operation, the exception names the
 * first of them in this order.
 */
public enum Flag {
    /** The operation is undefined for its operands. */
    INVALID,
    /** A finite non-zero dividend was divided by zero. */
    DIVIDE_BY_ZERO,
    /** The adjusted exponent of the result exceeds the maximum. */
    OVERFLOW,
    /** The result is subnormal and inexact. */
    UNDERFLOW,
    /** Non-zero digits were discarded from the result. */
    INEXACT,
    /** Digits were discarded from the result, zero or not. */
    ROUNDED,
    /** The adjusted exponent of the result is below the minimum. */
    SUBNORMAL,
    /** The exponent of the result was altered to fit the range. */
    CLAMPED;
}
