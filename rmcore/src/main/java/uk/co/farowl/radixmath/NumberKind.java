// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

/** The kind of a number value, distinguishing the special values. */
public enum NumberKind {
    /** A finite number: sign, mantissa and exponent are meaningful. */
    FINITE,
    /** Positive or negative infinity. */
    INFINITY,
    /** A quiet NaN, which propagates through operations silently. */
    QUIET_NAN,
    /** A signaling NaN, which is an invalid operand everywhere. */
    SIGNALING_NAN;

    /** @return whether this is either kind of NaN */
    public boolean isNaN() {
        return this == QUIET_NAN || this == SIGNALING_NAN;
    }
}
