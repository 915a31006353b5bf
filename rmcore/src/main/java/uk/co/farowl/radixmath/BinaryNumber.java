// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;

/**
 * An immutable binary (radix 2) number with arbitrary precision,
 * signed zeros, infinities and NaNs with payloads. Every {@code double}
 * converts to a {@code BinaryNumber} exactly.
 * <p>
 * The text form of a finite number is the integer mantissa and, unless
 * it is zero, a binary exponent after a {@code p}, so that
 * {@code 3p-1} is 1.5.
 */
public final class BinaryNumber extends RadixNumber<BinaryNumber> {

    /** The arithmetic of binary numbers. */
    public static final DispatchingRadixMath<BinaryNumber> MATH =
            new DispatchingRadixMath<>(new BinaryRepresentation());

    // IEEE-754 64-bit floating point parameters
    private static final int SIGNIFICAND_BITS = 52; // exc. implied 1
    private static final int EXPONENT_BITS = 11;
    private static final int EXPONENT_BIAS = 1023;
    private static final int MAX_EXPONENT_FIELD = 0x7ff;

    // Masks derived from the 64-bit floating point parameters
    private static final long IMPLIED_ONE = 1L << SIGNIFICAND_BITS;
    private static final long SIGNIFICAND = IMPLIED_ONE - 1;
    private static final long QUIET = IMPLIED_ONE >>> 1;
    private static final long SIGN = IMPLIED_ONE << EXPONENT_BITS;
    private static final long EXPONENT = SIGN - IMPLIED_ONE;

    BinaryNumber(boolean negative, BigInteger mantissa, BigInteger exponent,
            NumberKind kind) {
        super(negative, mantissa, exponent, kind);
    }

    @Override
    public RadixMath<BinaryNumber> math() { return MATH; }

    /**
     * {@code mantissa} &times; 2<sup>{@code exponent}</sup>.
     *
     * @param mantissa signed mantissa
     * @param exponent exponent
     * @return the number
     */
    public static BinaryNumber of(long mantissa, long exponent) {
        return new BinaryNumber(mantissa < 0,
                BigInteger.valueOf(mantissa).abs(),
                BigInteger.valueOf(exponent), NumberKind.FINITE);
    }

    /**
     * The number exactly equal to a {@code double}, with trailing zero
     * bits removed from the mantissa (zero has exponent zero). The sign
     * of a zero is kept. A NaN keeps its payload and its signaling or
     * quiet kind.
     *
     * @param value to convert
     * @return the number
     */
    public static BinaryNumber fromDouble(double value) {
        long raw = Double.doubleToRawLongBits(value);
        boolean negative = (raw & SIGN) != 0L;
        int e = (int)((raw & EXPONENT) >>> SIGNIFICAND_BITS);
        long significand = raw & SIGNIFICAND;

        if (e == MAX_EXPONENT_FIELD) {
            if (significand == 0L) {
                return new BinaryNumber(negative, BigInteger.ZERO,
                        BigInteger.ZERO, NumberKind.INFINITY);
            }
            NumberKind kind = (significand & QUIET) != 0L
                    ? NumberKind.QUIET_NAN : NumberKind.SIGNALING_NAN;
            return new BinaryNumber(negative,
                    BigInteger.valueOf(significand & (QUIET - 1)),
                    BigInteger.ZERO, kind);
        }

        int exponent;
        if (e == 0) {
            // Zero or subnormal: no implied one
            exponent = 1 - EXPONENT_BIAS - SIGNIFICAND_BITS;
        } else {
            significand |= IMPLIED_ONE;
            exponent = e - EXPONENT_BIAS - SIGNIFICAND_BITS;
        }
        if (significand == 0L) {
            exponent = 0;
        } else {
            int tz = Long.numberOfTrailingZeros(significand);
            significand >>>= tz;
            exponent += tz;
        }
        return new BinaryNumber(negative, BigInteger.valueOf(significand),
                BigInteger.valueOf(exponent), NumberKind.FINITE);
    }

    /**
     * The nearest {@code double} (rounding half-even), with overflow
     * to an infinity and gradual underflow to zero. A NaN becomes
     * {@code Double.NaN}.
     *
     * @return this number as a {@code double}
     */
    public double toDouble() {
        switch (getKind()) {
            case INFINITY:
                return isNegative() ? Double.NEGATIVE_INFINITY
                        : Double.POSITIVE_INFINITY;
            case QUIET_NAN:
            case SIGNALING_NAN:
                return Double.NaN;
            default:
                break;
        }
        BinaryNumber r =
                MATH.roundToPrecision(this, PrecisionContext.BINARY64);
        double v;
        if (r.isInfinite()) {
            v = Double.POSITIVE_INFINITY;
        } else {
            // At most 53 bits and a representable exponent: exact
            v = Math.scalb(r.getMantissa().doubleValue(),
                    r.getExponent().intValueExact());
        }
        return isNegative() ? -v : v;
    }

    /**
     * The decimal number of exactly the same value: a binary fraction
     * always has a terminating decimal expansion.
     *
     * @return this number in decimal
     */
    public DecimalNumber toDecimal() {
        BigInteger m = getMantissa();
        BigInteger e = getExponent();
        if (!isFinite()) {
            return new DecimalNumber(isNegative(), m, BigInteger.ZERO,
                    getKind());
        } else if (e.signum() >= 0) {
            return new DecimalNumber(isNegative(),
                    m.shiftLeft(e.intValueExact()), BigInteger.ZERO,
                    NumberKind.FINITE);
        } else {
            // m * 2**-k = m * 5**k * 10**-k
            int k = e.negate().intValueExact();
            return new DecimalNumber(isNegative(),
                    m.multiply(BigInteger.valueOf(5).pow(k)), e,
                    NumberKind.FINITE);
        }
    }

    @Override
    protected String finiteToString() {
        BigInteger e = getExponent();
        return e.signum() == 0 ? getMantissa().toString()
                : getMantissa() + "p" + e;
    }

    /** The representation through which the engines see binaries. */
    private static final class BinaryRepresentation
            extends Representation<BinaryNumber> {

        @Override
        public int radix() { return 2; }

        @Override
        public BinaryNumber create(boolean negative, BigInteger mantissa,
                BigInteger exponent, NumberKind kind) {
            return new BinaryNumber(negative, mantissa, exponent, kind);
        }
    }
}
