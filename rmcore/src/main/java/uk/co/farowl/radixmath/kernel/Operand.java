// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;

import uk.co.farowl.radixmath.NumberKind;
import uk.co.farowl.radixmath.NumberRepresentation;

/**
 * A number taken apart, as the full engine works on it. Every
 * operation of the engine decomposes its operands into this form on
 * entry and builds its result from this form on exit, so that the
 * representation is consulted in only those two places.
 *
 * @param negative sign
 * @param mantissa non-negative mantissa, or NaN payload
 * @param exponent exponent (zero for special values)
 * @param kind kind of number
 */
record Operand(boolean negative, BigInteger mantissa, BigInteger exponent,
        NumberKind kind) {

    /** A quiet NaN without payload. */
    static final Operand NAN = new Operand(false, BigInteger.ZERO,
            BigInteger.ZERO, NumberKind.QUIET_NAN);

    static Operand finite(boolean negative, BigInteger mantissa,
            BigInteger exponent) {
        return new Operand(negative, mantissa, exponent, NumberKind.FINITE);
    }

    static Operand zero(boolean negative, BigInteger exponent) {
        return finite(negative, BigInteger.ZERO, exponent);
    }

    static Operand infinity(boolean negative) {
        return new Operand(negative, BigInteger.ZERO, BigInteger.ZERO,
                NumberKind.INFINITY);
    }

    static Operand valueOf(long n) {
        return finite(n < 0, BigInteger.valueOf(n).abs(), BigInteger.ZERO);
    }

    /**
     * Take apart a value.
     *
     * @param <T> number type
     * @param rep the representation
     * @param value to take apart
     * @return the parts
     */
    static <T> Operand of(NumberRepresentation<T> rep, T value) {
        NumberKind kind = rep.kind(value);
        if (kind == NumberKind.INFINITY) {
            return infinity(rep.isNegative(value));
        }
        BigInteger e = kind == NumberKind.FINITE ? rep.exponent(value)
                : BigInteger.ZERO;
        return new Operand(rep.isNegative(value), rep.mantissa(value), e,
                kind);
    }

    /**
     * Build a value from these parts.
     *
     * @param <T> number type
     * @param rep the representation
     * @return the value
     */
    <T> T to(NumberRepresentation<T> rep) {
        return rep.create(negative, mantissa, exponent, kind);
    }

    boolean isFinite() { return kind == NumberKind.FINITE; }

    boolean isInfinite() { return kind == NumberKind.INFINITY; }

    boolean isNaN() { return kind.isNaN(); }

    boolean isSignaling() { return kind == NumberKind.SIGNALING_NAN; }

    boolean isQuietNaN() { return kind == NumberKind.QUIET_NAN; }

    /** @return whether this is a finite zero of either sign */
    boolean isZero() {
        return kind == NumberKind.FINITE && mantissa.signum() == 0;
    }

    /** @return whether this is a finite number with an integer value */
    boolean isInteger(Radix r) {
        if (!isFinite()) { return false; }
        if (exponent.signum() >= 0 || mantissa.signum() == 0) {
            return true;
        }
        // Negative exponent: the trailing digits must all be zero
        BigInteger[] me = r.stripZeros(mantissa, exponent, BigInteger.ZERO);
        return me[1].signum() >= 0;
    }

    /**
     * @param r radix of the number
     * @return exponent of the most significant digit (of a zero, the
     *     exponent)
     */
    BigInteger adjusted(Radix r) {
        return exponent.add(BigInteger.valueOf(r.digits(mantissa) - 1));
    }

    /** @return this with the opposite sign */
    Operand negate() {
        return new Operand(!negative, mantissa, exponent, kind);
    }

    /**
     * @param neg the sign required
     * @return this with the given sign
     */
    Operand withSign(boolean neg) {
        return neg == negative ? this
                : new Operand(neg, mantissa, exponent, kind);
    }

    /** @return the quiet NaN corresponding to a signaling one */
    Operand quiet() {
        return new Operand(negative, mantissa, exponent,
                NumberKind.QUIET_NAN);
    }
}
