// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * An immutable decimal (radix 10) number with arbitrary precision,
 * signed zeros, infinities and NaNs with payloads.
 * <p>
 * The text form follows the scientific string form of
 * {@code java.math.BigDecimal}, extended with {@code Infinity},
 * {@code NaN} and {@code sNaN} (each optionally signed, NaNs optionally
 * followed by a decimal payload).
 */
public final class DecimalNumber extends RadixNumber<DecimalNumber> {

    /** The arithmetic of decimal numbers. */
    public static final DispatchingRadixMath<DecimalNumber> MATH =
            new DispatchingRadixMath<>(new DecimalRepresentation());

    private static final BigInteger FIVE = BigInteger.valueOf(5);

    /**
     * Adjusted exponents beyond which a conversion to {@code double}
     * is certainly infinite or zero.
     */
    private static final int DOUBLE_ADJUSTED_MAX = 310,
            DOUBLE_ADJUSTED_MIN = -330;

    DecimalNumber(boolean negative, BigInteger mantissa,
            BigInteger exponent, NumberKind kind) {
        super(negative, mantissa, exponent, kind);
    }

    @Override
    public RadixMath<DecimalNumber> math() { return MATH; }

    /**
     * {@code mantissa} &times; 10<sup>{@code exponent}</sup>.
     *
     * @param mantissa signed mantissa
     * @param exponent exponent
     * @return the number
     */
    public static DecimalNumber of(long mantissa, long exponent) {
        return new DecimalNumber(mantissa < 0,
                BigInteger.valueOf(mantissa).abs(),
                BigInteger.valueOf(exponent), NumberKind.FINITE);
    }

    /**
     * The number exactly equal to a {@code BigDecimal}, with the same
     * digits and scale.
     *
     * @param value to convert
     * @return the number
     */
    public static DecimalNumber of(BigDecimal value) {
        return new DecimalNumber(value.signum() < 0,
                value.unscaledValue().abs(),
                BigInteger.valueOf(-(long)value.scale()), NumberKind.FINITE);
    }

    /**
     * Parse the text form. Case is not significant in the special
     * values, and {@code Inf} is accepted for {@code Infinity}.
     *
     * @param s text to parse
     * @return the number
     * @throws NumberFormatException if the text is not a number
     */
    public static DecimalNumber fromString(String s) {
        Objects.requireNonNull(s, "s");
        boolean negative = s.startsWith("-");
        String body = negative || s.startsWith("+") ? s.substring(1) : s;
        if (body.isEmpty() || body.startsWith("-") || body.startsWith("+")) {
            throw new NumberFormatException("not a number: " + s);
        }
        String lower = body.toLowerCase(Locale.ROOT);
        if (lower.equals("infinity") || lower.equals("inf")) {
            return new DecimalNumber(negative, BigInteger.ZERO,
                    BigInteger.ZERO, NumberKind.INFINITY);
        } else if (lower.startsWith("nan")) {
            return new DecimalNumber(negative, payload(s, body.substring(3)),
                    BigInteger.ZERO, NumberKind.QUIET_NAN);
        } else if (lower.startsWith("snan")) {
            return new DecimalNumber(negative, payload(s, body.substring(4)),
                    BigInteger.ZERO, NumberKind.SIGNALING_NAN);
        }
        // The exponent may be beyond the range of a BigDecimal scale
        int e = 0;
        while (e < body.length() && body.charAt(e) != 'e'
                && body.charAt(e) != 'E') {
            e++;
        }
        BigInteger exponent = BigInteger.ZERO;
        if (e < body.length()) {
            exponent = new BigInteger(body.substring(e + 1));
            body = body.substring(0, e);
        }
        BigDecimal d = new BigDecimal(body);
        return new DecimalNumber(negative, d.unscaledValue(),
                exponent.subtract(BigInteger.valueOf(d.scale())),
                NumberKind.FINITE);
    }

    private static BigInteger payload(String s, String digits) {
        if (digits.isEmpty()) { return BigInteger.ZERO; }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new NumberFormatException("bad NaN payload: " + s);
            }
        }
        return new BigInteger(digits);
    }

    /**
     * The equal {@code BigDecimal}. The sign of a zero is lost.
     *
     * @return this number as a {@code BigDecimal}
     * @throws ArithmeticException if this is not finite, or its
     *     exponent is beyond the scale of a {@code BigDecimal}
     */
    public BigDecimal toBigDecimal() {
        if (!isFinite()) {
            throw new ArithmeticException("not finite: " + this);
        }
        BigInteger m = getMantissa();
        return new BigDecimal(isNegative() ? m.negate() : m,
                getExponent().negate().intValueExact());
    }

    /**
     * Convert to binary, correctly rounded to the context. The
     * conversion raises conditions in the context, like any other
     * operation. Under an unlimited context the conversion is exact
     * when it can be, and otherwise a NaN with
     * {@link Flag#INVALID}.
     *
     * @param ctx context of the binary result or {@code null}
     * @return this number in binary
     * @throws ArithmeticException if the exponent is beyond an int
     */
    public BinaryNumber toBinary(PrecisionContext ctx) {
        if (!isFinite()) {
            return new BinaryNumber(isNegative(), getMantissa(),
                    BigInteger.ZERO, getKind());
        }
        int e = getExponent().intValueExact();
        if (e >= 0) {
            // m * 10**e = (m * 5**e) * 2**e exactly
            BinaryNumber exact = new BinaryNumber(isNegative(),
                    getMantissa().multiply(FIVE.pow(e)), getExponent(),
                    NumberKind.FINITE);
            return BinaryNumber.MATH.roundToPrecision(exact, ctx);
        } else {
            // m * 10**e = (m * 2**e) / 5**-e, one correctly rounded step
            BinaryNumber num = new BinaryNumber(isNegative(), getMantissa(),
                    getExponent(), NumberKind.FINITE);
            BinaryNumber den = new BinaryNumber(false, FIVE.pow(-e),
                    BigInteger.ZERO, NumberKind.FINITE);
            return BinaryNumber.MATH.divide(num, den, ctx);
        }
    }

    /**
     * The nearest {@code double} (rounding half-even), with overflow
     * to an infinity and gradual underflow to zero.
     *
     * @return this number as a {@code double}
     */
    public double toDouble() {
        if (isZero()) {
            return isNegative() ? -0.0 : 0.0;
        } else if (isFinite()) {
            BigInteger adj = getExponent().add(BigInteger.valueOf(
                    getMantissa().toString().length() - 1));
            if (adj.compareTo(BigInteger.valueOf(DOUBLE_ADJUSTED_MAX)) > 0) {
                return isNegative() ? Double.NEGATIVE_INFINITY
                        : Double.POSITIVE_INFINITY;
            } else if (adj.compareTo(
                    BigInteger.valueOf(DOUBLE_ADJUSTED_MIN)) < 0) {
                return isNegative() ? -0.0 : 0.0;
            }
        }
        return toBinary(PrecisionContext.BINARY64).toDouble();
    }

    @Override
    protected String finiteToString() {
        BigInteger e = getExponent();
        if (e.bitLength() < 31) {
            return new BigDecimal(getMantissa(), -e.intValue()).toString();
        }
        // Beyond the scale of BigDecimal: plain digits and exponent
        return getMantissa() + "E" + (e.signum() >= 0 ? "+" : "") + e;
    }

    /** The representation through which the engines see decimals. */
    private static final class DecimalRepresentation
            extends Representation<DecimalNumber> {

        @Override
        public int radix() { return 10; }

        @Override
        public DecimalNumber create(boolean negative, BigInteger mantissa,
                BigInteger exponent, NumberKind kind) {
            return new DecimalNumber(negative, mantissa, exponent, kind);
        }
    }
}
