// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;

/**
 * The capability through which the arithmetic engines take apart and
 * build the numbers of one representation. The engines are generic in
 * the number type {@code T} and know nothing about it beyond what this
 * interface reports: in particular they make no assumption about the
 * radix.
 * <p>
 * A finite number has the value
 * <i>sign</i>&nbsp;·&nbsp;<i>mantissa</i>&nbsp;·&nbsp;
 * <i>radix</i><sup><i>exponent</i></sup>.
 * The mantissa of a NaN is its diagnostic payload (zero if none). The
 * mantissa and exponent of an infinity are zero.
 *
 * @param <T> the number type
 */
public interface NumberRepresentation<T> {

    /** @return the radix of this representation (at least 2) */
    int radix();

    /**
     * @param value to examine
     * @return kind of the value
     */
    NumberKind kind(T value);

    /**
     * @param value to examine
     * @return whether the sign of the value is negative
     */
    boolean isNegative(T value);

    /**
     * @param value to examine
     * @return the non-negative mantissa (or NaN payload)
     */
    BigInteger mantissa(T value);

    /**
     * @param value to examine
     * @return the exponent
     */
    BigInteger exponent(T value);

    /**
     * Build a value from its parts. Implementations may rely on the
     * mantissa being non-negative.
     *
     * @param negative sign of the result
     * @param mantissa non-negative mantissa (or NaN payload)
     * @param exponent exponent (ignored for special values)
     * @param kind of value to create
     * @return the new value
     */
    T create(boolean negative, BigInteger mantissa, BigInteger exponent,
            NumberKind kind);

    /**
     * @param negative sign of the result
     * @param mantissa non-negative mantissa
     * @param exponent exponent
     * @return finite value
     */
    default T finite(boolean negative, BigInteger mantissa,
            BigInteger exponent) {
        return create(negative, mantissa, exponent, NumberKind.FINITE);
    }

    /**
     * @param n integer value
     * @return {@code n} with exponent zero
     */
    default T valueOf(long n) {
        return finite(n < 0, BigInteger.valueOf(n).abs(), BigInteger.ZERO);
    }

    /** @return positive zero with exponent zero */
    default T zero() { return valueOf(0); }

    /** @return one with exponent zero */
    default T one() { return valueOf(1); }

    /** @return a quiet NaN without payload */
    default T nan() {
        return create(false, BigInteger.ZERO, BigInteger.ZERO,
                NumberKind.QUIET_NAN);
    }

    /**
     * @param negative sign of the infinity
     * @return positive or negative infinity
     */
    default T infinity(boolean negative) {
        return create(negative, BigInteger.ZERO, BigInteger.ZERO,
                NumberKind.INFINITY);
    }
}
