// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;

/**
 * The arithmetic operations on numbers of one representation, performed
 * under a {@link PrecisionContext}. Every operation returns a new value
 * and leaves its operands unchanged. Conditions raised by an operation
 * are recorded in the flag accumulator of the context (if it has one),
 * after which, if any of them is trapped, the operation throws
 * {@link TrapException} instead of returning.
 * <p>
 * Where a context is accepted it may be {@code null}, meaning unlimited
 * precision and exponent range, with nothing recorded or trapped. The
 * exception is {@link #pi(PrecisionContext)}.
 * <p>
 * Special values follow the same rules in every operation unless the
 * operation says otherwise: a signaling NaN operand gives a quiet NaN
 * (with the same payload) and raises {@link Flag#INVALID}; otherwise a
 * quiet NaN operand is returned as the result.
 *
 * @param <T> the number type
 */
public interface RadixMath<T> {

    /** @return the capability through which numbers are handled */
    NumberRepresentation<T> getRepresentation();

    // Arithmetic ----------------------------------------------------

    /**
     * Sum of two numbers, rounded to the context.
     *
     * @param x augend
     * @param y addend
     * @param ctx context or {@code null}
     * @return {@code x + y}
     */
    T add(T x, T y, PrecisionContext ctx);

    /**
     * Sum of two numbers, optionally rounding each operand to the
     * precision of the context before adding.
     *
     * @param x augend
     * @param y addend
     * @param ctx context or {@code null}
     * @param roundToOperandPrecision whether to round the operands
     *     first
     * @return {@code x + y}
     */
    T addEx(T x, T y, PrecisionContext ctx,
            boolean roundToOperandPrecision);

    /**
     * @param x multiplicand
     * @param y multiplier
     * @param ctx context or {@code null}
     * @return {@code x * y} rounded
     */
    T multiply(T x, T y, PrecisionContext ctx);

    /**
     * Fused multiply-add: the product is exact and the sum is rounded
     * once.
     *
     * @param x multiplicand
     * @param y multiplier
     * @param z addend
     * @param ctx context or {@code null}
     * @return {@code x * y + z}
     */
    T multiplyAndAdd(T x, T y, T z, PrecisionContext ctx);

    /**
     * Quotient rounded to the precision of the context. With unlimited
     * precision, a quotient with no terminating expansion in the radix
     * is invalid.
     *
     * @param x dividend
     * @param y divisor
     * @param ctx context or {@code null}
     * @return {@code x / y}
     */
    T divide(T x, T y, PrecisionContext ctx);

    /**
     * Quotient rounded to a given exponent.
     *
     * @param x dividend
     * @param y divisor
     * @param exponent of the result
     * @param ctx context or {@code null}
     * @return {@code x / y} with the given exponent
     */
    T divideToExponent(T x, T y, BigInteger exponent,
            PrecisionContext ctx);

    /**
     * Integer part of the quotient, with the preferred exponent of the
     * dividend's minus the divisor's.
     *
     * @param x dividend
     * @param y divisor
     * @param ctx context or {@code null}
     * @return integer part of {@code x / y}
     */
    T divideToIntegerNaturalScale(T x, T y, PrecisionContext ctx);

    /**
     * Integer part of the quotient, with exponent zero.
     *
     * @param x dividend
     * @param y divisor
     * @param ctx context or {@code null}
     * @return integer part of {@code x / y}
     */
    T divideToIntegerZeroScale(T x, T y, PrecisionContext ctx);

    /**
     * Remainder of truncating division.
     *
     * @param x dividend
     * @param y divisor
     * @param ctx context or {@code null}
     * @return {@code x - y * trunc(x / y)}
     */
    T remainder(T x, T y, PrecisionContext ctx);

    /**
     * Remainder of division rounding to nearest (IEEE remainder).
     *
     * @param x dividend
     * @param y divisor
     * @param ctx context or {@code null}
     * @return {@code x - y * n} where {@code n} is {@code x / y} rounded
     *     half-even to an integer
     */
    T remainderNear(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} with its sign reversed, rounded
     */
    T negate(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} with its sign cleared, rounded
     */
    T abs(T x, PrecisionContext ctx);

    // Comparison ----------------------------------------------------

    /**
     * Numerical comparison giving −1, 0 or 1 as a number, or a NaN if
     * either operand is a NaN.
     *
     * @param x left operand
     * @param y right operand
     * @param treatQuietNansAsSignaling whether a quiet NaN operand is
     *     also invalid
     * @param ctx context or {@code null}
     * @return comparison result as a number
     */
    T compareToWithContext(T x, T y, boolean treatQuietNansAsSignaling,
            PrecisionContext ctx);

    /**
     * Context-free total ordering by numerical value, in which all NaNs
     * are equal and greater than positive infinity.
     *
     * @param x left operand
     * @param y right operand
     * @return negative, zero or positive as {@code x} is less than,
     *     equal to or greater than {@code y}
     */
    int compareTo(T x, T y);

    /**
     * @param x operand
     * @param y operand
     * @param ctx context or {@code null}
     * @return the lesser operand, rounded
     */
    T min(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param y operand
     * @param ctx context or {@code null}
     * @return the greater operand, rounded
     */
    T max(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param y operand
     * @param ctx context or {@code null}
     * @return the operand of lesser magnitude, rounded
     */
    T minMagnitude(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param y operand
     * @param ctx context or {@code null}
     * @return the operand of greater magnitude, rounded
     */
    T maxMagnitude(T x, T y, PrecisionContext ctx);

    // Rounding and quantization -------------------------------------

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} rounded to the context
     */
    T roundToPrecision(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} rounded to the context, the precision counting
     *     binary digits
     */
    T roundToBinaryPrecision(T x, PrecisionContext ctx);

    /**
     * Round a value just converted from another representation. A NaN
     * keeps its kind (signaling or quiet) and its payload is cut to the
     * precision.
     *
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} rounded to the context
     */
    T roundAfterConversion(T x, PrecisionContext ctx);

    /**
     * Round to the context, and make a negative zero positive (except
     * when rounding towards negative infinity).
     *
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code 0 + x}
     */
    T plus(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param y value supplying the exponent
     * @param ctx context or {@code null}
     * @return {@code x} rounded to the exponent of {@code y}
     */
    T quantize(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param exponent target exponent
     * @param ctx context or {@code null}
     * @return {@code x} rounded to the exponent if that is smaller than
     *     its own, or rounded to the context
     */
    T roundToExponentExact(T x, BigInteger exponent, PrecisionContext ctx);

    /**
     * As {@link #roundToExponentExact}, but a result too wide for the
     * precision is rounded further rather than invalid.
     *
     * @param x operand
     * @param exponent target exponent
     * @param ctx context or {@code null}
     * @return rounded {@code x}
     */
    T roundToExponentSimple(T x, BigInteger exponent,
            PrecisionContext ctx);

    /**
     * As {@link #roundToExponentExact}, without reporting
     * {@link Flag#INEXACT} or {@link Flag#ROUNDED}.
     *
     * @param x operand
     * @param exponent target exponent
     * @param ctx context or {@code null}
     * @return rounded {@code x}
     */
    T roundToExponentNoRoundedFlag(T x, BigInteger exponent,
            PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return {@code x} rounded, with trailing zeros removed
     */
    T reduce(T x, PrecisionContext ctx);

    // Navigation ----------------------------------------------------

    /**
     * @param x operand
     * @param ctx context with a precision and exponent range
     * @return the largest representable number less than {@code x}
     */
    T nextMinus(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context with a precision and exponent range
     * @return the smallest representable number greater than {@code x}
     */
    T nextPlus(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param y direction
     * @param ctx context with a precision and exponent range
     * @return the representable number next to {@code x} towards
     *     {@code y}
     */
    T nextToward(T x, T y, PrecisionContext ctx);

    // Elementary functions ------------------------------------------

    /**
     * @param ctx context with a precision (not {@code null})
     * @return π rounded to the context
     * @throws NullPointerException if {@code ctx} is {@code null}
     */
    T pi(PrecisionContext ctx);

    /**
     * @param x base
     * @param y exponent
     * @param ctx context or {@code null}
     * @return <i>x</i><sup><i>y</i></sup> rounded
     */
    T power(T x, T y, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return base-10 logarithm of {@code x}, rounded
     */
    T log10(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return natural logarithm of {@code x}, rounded
     */
    T ln(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return <i>e</i><sup><i>x</i></sup> rounded
     */
    T exp(T x, PrecisionContext ctx);

    /**
     * @param x operand
     * @param ctx context or {@code null}
     * @return square root of {@code x}, rounded
     */
    T squareRoot(T x, PrecisionContext ctx);
}
