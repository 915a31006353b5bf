// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Base of the immutable number types the library ships. A number has a
 * sign, a non-negative mantissa, an exponent and a {@link NumberKind},
 * interpreted in the radix of the concrete type. Equality is
 * structural: {@code 1.0} and {@code 1.00} are different objects that
 * compare as equal under {@link #compareTo(RadixNumber)}.
 *
 * @param <N> the concrete type
 */
public abstract class RadixNumber<N extends RadixNumber<N>>
        implements Comparable<N> {

    private final boolean negative;
    private final BigInteger mantissa;
    private final BigInteger exponent;
    private final NumberKind kind;

    /**
     * Construct from the parts. The mantissa and exponent of an infinity,
     * and the exponent of a NaN, are forced to zero.
     *
     * @param negative sign
     * @param mantissa non-negative mantissa (or NaN payload)
     * @param exponent exponent
     * @param kind of number
     * @throws IllegalArgumentException if the mantissa is negative
     */
    protected RadixNumber(boolean negative, BigInteger mantissa,
            BigInteger exponent, NumberKind kind) {
        Objects.requireNonNull(mantissa, "mantissa");
        Objects.requireNonNull(exponent, "exponent");
        if (mantissa.signum() < 0) {
            throw new IllegalArgumentException(
                    "mantissa must not be negative: " + mantissa);
        }
        this.negative = negative;
        this.kind = Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case FINITE:
                this.mantissa = mantissa;
                this.exponent = exponent;
                break;
            case INFINITY:
                this.mantissa = BigInteger.ZERO;
                this.exponent = BigInteger.ZERO;
                break;
            default:
                this.mantissa = mantissa;
                this.exponent = BigInteger.ZERO;
        }
    }

    /** @return the arithmetic of this type */
    public abstract RadixMath<N> math();

    /** @return the radix of this type */
    public int radix() { return math().getRepresentation().radix(); }

    /** @return whether the sign is negative */
    public boolean isNegative() { return negative; }

    /** @return the mantissa (or NaN payload) */
    public BigInteger getMantissa() { return mantissa; }

    /** @return the exponent */
    public BigInteger getExponent() { return exponent; }

    /** @return the kind of number */
    public NumberKind getKind() { return kind; }

    /** @return whether finite */
    public boolean isFinite() { return kind == NumberKind.FINITE; }

    /** @return whether an infinity */
    public boolean isInfinite() { return kind == NumberKind.INFINITY; }

    /** @return whether either kind of NaN */
    public boolean isNaN() { return kind.isNaN(); }

    /** @return whether a zero of either sign */
    public boolean isZero() { return isFinite() && mantissa.signum() == 0; }

    /**
     * The context-free total order of {@link RadixMath#compareTo}, in
     * which NaNs are equal to each other and above positive infinity.
     */
    @Override
    @SuppressWarnings("unchecked")
    public int compareTo(N other) { return math().compareTo((N)this, other); }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        RadixNumber<?> o = (RadixNumber<?>)obj;
        return kind == o.kind && negative == o.negative
                && mantissa.equals(o.mantissa)
                && exponent.equals(o.exponent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, negative, mantissa, exponent);
    }

    @Override
    public String toString() {
        String sign = negative ? "-" : "";
        switch (kind) {
            case INFINITY:
                return sign + "Infinity";
            case QUIET_NAN:
                return sign + "NaN" + payload();
            case SIGNALING_NAN:
                return sign + "sNaN" + payload();
            default:
                return sign + finiteToString();
        }
    }

    private String payload() {
        return mantissa.signum() == 0 ? "" : mantissa.toString();
    }

    /**
     * @return the magnitude of this finite number as text, in a form
     *     natural to the radix
     */
    protected abstract String finiteToString();

    /**
     * The common part of the representation of the shipped types: they
     * keep their parts in fields.
     *
     * @param <N> the concrete type
     */
    protected abstract static class Representation<N extends RadixNumber<N>>
            implements NumberRepresentation<N> {

        @Override
        public NumberKind kind(N value) { return value.getKind(); }

        @Override
        public boolean isNegative(N value) { return value.isNegative(); }

        @Override
        public BigInteger mantissa(N value) { return value.getMantissa(); }

        @Override
        public BigInteger exponent(N value) { return value.getExponent(); }
    }
}
