// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.options;

import java.math.BigInteger;
import java.util.regex.Pattern;

import uk.co.farowl.radixmath.DecimalNumber;

/**
 * Policies for turning the text of a JSON number into a Java value.
 */
public enum NumberConversion {

    /** The exact decimal value, as a {@link DecimalNumber}. */
    FULL("full") {
        @Override
        Object from(DecimalNumber d) { return d; }
    },

    /** The nearest {@code double}, as a {@code Double}. */
    DOUBLE("double") {
        @Override
        Object from(DecimalNumber d) { return d.toDouble(); }
    },

    /**
     * An integer when the number has an integer value that a CBOR
     * integer (major type 0 or 1) can hold, that is, in the range
     * -2<sup>64</sup> to 2<sup>64</sup>-1. It is a {@code Long} or, if
     * too large for that, a {@code BigInteger}. Any other number is the
     * nearest {@code double}. Negative zero is a {@code Double}.
     */
    INT_OR_FLOAT("intorfloat") {
        @Override
        Object from(DecimalNumber d) {
            if (d.isZero()) {
                // A conditional expression here would unbox to double
                if (d.isNegative()) { return -0.0; }
                return 0L;
            }
            DecimalNumber r = DecimalNumber.MATH.reduce(d, null);
            BigInteger e = r.getExponent();
            if (e.signum() < 0 || e.compareTo(MAX_INTEGER_EXPONENT) > 0) {
                return d.toDouble();
            }
            BigInteger v = r.toBigDecimal().toBigIntegerExact();
            if (v.compareTo(MIN_INTEGER) < 0 || v.compareTo(MAX_INTEGER) > 0) {
                return d.toDouble();
            }
            return v.bitLength() < 64 ? (Object)v.longValue() : v;
        }
    },

    /**
     * The nearest {@code double}, given as a {@code Long} when that is
     * an integer of magnitude at most 2<sup>53</sup>. Negative zero is a
     * {@code Double}.
     */
    INT_OR_FLOAT_FROM_DOUBLE("intorfloatfromdouble") {
        @Override
        Object from(DecimalNumber d) {
            double v = d.toDouble();
            if (v == Math.rint(v) && Math.abs(v) <= TWO_53
                    && !(v == 0.0 && d.isNegative())) {
                return (long)v;
            }
            return v;
        }
    };

    /**
     * A reduced integer with a larger exponent is at least
     * 10<sup>20</sup>, beyond {@link #MAX_INTEGER}.
     */
    private static final BigInteger MAX_INTEGER_EXPONENT =
            BigInteger.valueOf(19);

    /** Largest integer a CBOR integer holds, 2<sup>64</sup>-1. */
    private static final BigInteger MAX_INTEGER =
            BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    /** Smallest integer a CBOR integer holds, -2<sup>64</sup>. */
    private static final BigInteger MIN_INTEGER =
            BigInteger.ONE.shiftLeft(64).negate();

    private static final double TWO_53 = 0x1p53;

    /** The grammar of a JSON number. */
    private static final Pattern JSON_NUMBER =
            Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][-+]?[0-9]+)?");

    /** Name of the policy in an option string. */
    public final String optionName;

    private NumberConversion(String optionName) {
        this.optionName = optionName;
    }

    abstract Object from(DecimalNumber d);

    /**
     * Convert the text of a JSON number according to this policy.
     *
     * @param jsonNumber text of the number
     * @return the converted value
     * @throws NumberFormatException if the text is not a JSON number
     */
    public Object convert(String jsonNumber) {
        if (!JSON_NUMBER.matcher(jsonNumber).matches()) {
            throw new NumberFormatException(
                    "not a JSON number: " + jsonNumber);
        }
        return from(DecimalNumber.fromString(jsonNumber));
    }

    /**
     * The policy named in an option string. Any name not recognised
     * (and {@code null}) means {@link #FULL}.
     *
     * @param name of the policy (any case)
     * @return the policy
     */
    public static NumberConversion fromOptionName(String name) {
        if (name != null) {
            String n = OptionsParser.lower(name);
            for (NumberConversion c : values()) {
                if (c.optionName.equals(n)) { return c; }
            }
        }
        return FULL;
    }
}
