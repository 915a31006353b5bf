// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The configuration under which an arithmetic operation is performed:
 * precision, rounding mode, exponent range, which conditions trap, and
 * whether the simplified engine may be used.
 * <p>
 * The configuration is immutable. The conditions an operation raises
 * are output, not configuration: they go to a separate mutable
 * {@link FlagSet} that a context may carry by reference. The
 * {@code with*} methods return a new context sharing that accumulator
 * (so flags raised under a derived context reach the same place),
 * except {@link #withBlankFlags()} and {@link #withNoFlags()}.
 * <p>
 * A {@code null} context, wherever one is accepted, means
 * {@link #UNLIMITED}: unlimited precision, no exponent range, nothing
 * recorded and nothing trapped. The single exception is
 * {@link RadixMath#pi(PrecisionContext)}, which needs a precision.
 */
public final class PrecisionContext {

    /** Unlimited precision and exponent range, no flags, no traps. */
    public static final PrecisionContext UNLIMITED =
            new PrecisionContext(0, false, Rounding.HALF_EVEN, null, null,
                    false, EnumSet.noneOf(Flag.class), false, null);

    /**
     * The "basic" context of the General Decimal Arithmetic: 9 digits,
     * half-up, exponents within ±999, trapping the serious conditions.
     */
    public static final PrecisionContext BASIC =
            forPrecisionAndRounding(9, Rounding.HALF_UP)
                    .withExponentRange(-999, 999)
                    .withTraps(EnumSet.of(Flag.INVALID,
                            Flag.DIVIDE_BY_ZERO, Flag.OVERFLOW,
                            Flag.UNDERFLOW));

    /** IEEE 754 decimal32: 7 digits. */
    public static final PrecisionContext DECIMAL32 = ieee(7, -95, 96);

    /** IEEE 754 decimal64: 16 digits. */
    public static final PrecisionContext DECIMAL64 = ieee(16, -383, 384);

    /** IEEE 754 decimal128: 34 digits. */
    public static final PrecisionContext DECIMAL128 =
            ieee(34, -6143, 6144);

    /** IEEE 754 binary32: 24 bits. */
    public static final PrecisionContext BINARY32 =
            ieee(24, -126, 127).withPrecisionInBits(true)
                    .withClampNormalExponents(false);

    /** IEEE 754 binary64 (Java {@code double}): 53 bits. */
    public static final PrecisionContext BINARY64 =
            ieee(53, -1022, 1023).withPrecisionInBits(true)
                    .withClampNormalExponents(false);

    private final int precision;
    private final boolean precisionInBits;
    private final Rounding rounding;
    /** Minimum adjusted exponent or {@code null} if unbounded. */
    private final BigInteger eMin;
    /** Maximum adjusted exponent or {@code null} if unbounded. */
    private final BigInteger eMax;
    private final boolean clampNormalExponents;
    private final Set<Flag> traps;
    private final boolean simplified;
    /** Where raised conditions are recorded, or {@code null}. */
    private final FlagSet flags;

    private PrecisionContext(int precision, boolean precisionInBits,
            Rounding rounding, BigInteger eMin, BigInteger eMax,
            boolean clampNormalExponents, Set<Flag> traps,
            boolean simplified, FlagSet flags) {
        if (precision < 0) {
            throw new IllegalArgumentException(
                    "precision must not be negative: " + precision);
        }
        if (eMin != null && eMin.compareTo(eMax) > 0) {
            throw new IllegalArgumentException(String.format(
                    "eMin (%s) exceeds eMax (%s)", eMin, eMax));
        }
        this.precision = precision;
        this.precisionInBits = precisionInBits;
        this.rounding = Objects.requireNonNull(rounding, "rounding");
        this.eMin = eMin;
        this.eMax = eMax;
        this.clampNormalExponents = clampNormalExponents;
        this.traps = traps.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(traps));
        this.simplified = simplified;
        this.flags = flags;
    }

    private static PrecisionContext ieee(int precision, long eMin,
            long eMax) {
        return forPrecisionAndRounding(precision, Rounding.HALF_EVEN)
                .withExponentRange(eMin, eMax)
                .withClampNormalExponents(true);
    }

    /**
     * Resolve an optional context to the one an operation actually
     * uses. This is the one place where the meaning of "no context" is
     * defined.
     *
     * @param ctx context or {@code null}
     * @return {@code ctx} or {@link #UNLIMITED}
     */
    public static PrecisionContext orDefault(PrecisionContext ctx) {
        return ctx == null ? UNLIMITED : ctx;
    }

    /**
     * @param precision maximum number of digits (0 for unlimited)
     * @return a context with that precision, rounding half-even
     */
    public static PrecisionContext forPrecision(int precision) {
        return UNLIMITED.withPrecision(precision);
    }

    /**
     * @param rounding mode to use
     * @return a context with unlimited precision and the given mode
     */
    public static PrecisionContext forRounding(Rounding rounding) {
        return UNLIMITED.withRounding(rounding);
    }

    /**
     * @param precision maximum number of digits (0 for unlimited)
     * @param rounding mode to use
     * @return a context with that precision and rounding mode
     */
    public static PrecisionContext forPrecisionAndRounding(int precision,
            Rounding rounding) {
        return UNLIMITED.withPrecision(precision).withRounding(rounding);
    }

    // Attributes ----------------------------------------------------

    /** @return maximum number of digits, or 0 for unlimited */
    public int getPrecision() { return precision; }

    /** @return whether the precision is limited */
    public boolean hasMaxPrecision() { return precision > 0; }

    /** @return whether the precision counts binary digits */
    public boolean isPrecisionInBits() { return precisionInBits; }

    /** @return the rounding mode */
    public Rounding getRounding() { return rounding; }

    /** @return whether exponents are bounded */
    public boolean hasExponentRange() { return eMin != null; }

    /** @return the minimum adjusted exponent ({@code null} if none) */
    public BigInteger getEMin() { return eMin; }

    /** @return the maximum adjusted exponent ({@code null} if none) */
    public BigInteger getEMax() { return eMax; }

    /** @return whether large exponents fold down (IEEE clamp) */
    public boolean isClampNormalExponents() {
        return clampNormalExponents;
    }

    /** @return the trapped conditions (unmodifiable) */
    public Set<Flag> getTraps() { return traps; }

    /**
     * @param flag condition to test
     * @return whether it traps
     */
    public boolean isTrapped(Flag flag) { return traps.contains(flag); }

    /** @return whether the simplified engine is selected */
    public boolean isSimplified() { return simplified; }

    /** @return whether raised conditions are recorded */
    public boolean hasFlags() { return flags != null; }

    /** @return the flag accumulator or {@code null} */
    public FlagSet getFlags() { return flags; }

    // Derived contexts ----------------------------------------------

    /**
     * @param precision maximum number of digits (0 for unlimited)
     * @return context differing only in precision
     */
    public PrecisionContext withPrecision(int precision) {
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                flags);
    }

    /**
     * @param inBits whether the precision counts binary digits
     * @return context differing only in that respect
     */
    public PrecisionContext withPrecisionInBits(boolean inBits) {
        return new PrecisionContext(precision, inBits, rounding, eMin,
                eMax, clampNormalExponents, traps, simplified, flags);
    }

    /**
     * @param rounding mode to use
     * @return context differing only in rounding mode
     */
    public PrecisionContext withRounding(Rounding rounding) {
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                flags);
    }

    /**
     * @param eMin minimum adjusted exponent
     * @param eMax maximum adjusted exponent
     * @return context differing only in exponent range
     * @throws IllegalArgumentException if {@code eMin > eMax}
     */
    public PrecisionContext withExponentRange(BigInteger eMin,
            BigInteger eMax) {
        return new PrecisionContext(precision, precisionInBits, rounding,
                Objects.requireNonNull(eMin, "eMin"),
                Objects.requireNonNull(eMax, "eMax"),
                clampNormalExponents, traps, simplified, flags);
    }

    /**
     * @param eMin minimum adjusted exponent
     * @param eMax maximum adjusted exponent
     * @return context differing only in exponent range
     * @throws IllegalArgumentException if {@code eMin > eMax}
     */
    public PrecisionContext withExponentRange(long eMin, long eMax) {
        return withExponentRange(BigInteger.valueOf(eMin),
                BigInteger.valueOf(eMax));
    }

    /** @return context differing only in having no exponent range */
    public PrecisionContext withUnlimitedExponents() {
        return new PrecisionContext(precision, precisionInBits, rounding,
                null, null, clampNormalExponents, traps, simplified,
                flags);
    }

    /**
     * @param clamp whether large exponents fold down (IEEE clamp)
     * @return context differing only in that respect
     */
    public PrecisionContext withClampNormalExponents(boolean clamp) {
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clamp, traps, simplified, flags);
    }

    /**
     * @param traps the conditions that should trap
     * @return context differing only in traps
     */
    public PrecisionContext withTraps(Set<Flag> traps) {
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                flags);
    }

    /**
     * @param first a condition that should trap
     * @param rest further conditions that should trap
     * @return context differing only in traps
     */
    public PrecisionContext withTraps(Flag first, Flag... rest) {
        return withTraps(EnumSet.of(first, rest));
    }

    /**
     * @param simplified whether to select the simplified engine
     * @return context differing only in that respect
     */
    public PrecisionContext withSimplified(boolean simplified) {
        if (simplified == this.simplified) { return this; }
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                flags);
    }

    /**
     * @return a context with the same configuration and a new, empty
     *     flag accumulator
     */
    public PrecisionContext withBlankFlags() {
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                new FlagSet());
    }

    /**
     * @return a context with the same configuration that records
     *     nothing
     */
    public PrecisionContext withNoFlags() {
        if (flags == null) { return this; }
        return new PrecisionContext(precision, precisionInBits, rounding,
                eMin, eMax, clampNormalExponents, traps, simplified,
                null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PrecisionContext[");
        sb.append("precision=").append(precision);
        if (precisionInBits) { sb.append(" bits"); }
        sb.append(", rounding=").append(rounding);
        if (eMin != null) {
            sb.append(", eMin=").append(eMin).append(", eMax=")
                    .append(eMax);
        }
        if (clampNormalExponents) { sb.append(", clamp"); }
        if (!traps.isEmpty()) { sb.append(", traps=").append(traps); }
        if (simplified) { sb.append(", simplified"); }
        if (flags != null) { sb.append(", flags=").append(flags); }
        return sb.append(']').toString();
    }
}
