// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.radixmath.Flag;
import uk.co.farowl.radixmath.NumberKind;
import uk.co.farowl.radixmath.NumberRepresentation;
import uk.co.farowl.radixmath.Operation;
import uk.co.farowl.radixmath.PrecisionContext;
import uk.co.farowl.radixmath.RadixMath;
import uk.co.farowl.radixmath.Rounding;
import uk.co.farowl.radixmath.support.RadixMathError;

/**
 * An engine that computes in {@code long} arithmetic when operands and
 * context permit, and otherwise hands the operation to a
 * {@link FullRadixMath}. Its results (values and conditions) are
 * identical to those of the full engine: it declines whenever a result
 * would need handling it does not attempt, which includes any overflow
 * of the {@code long} arithmetic and any result that is subnormal,
 * overflows the exponent range or has its exponent clamped.
 * <p>
 * The operations it has no fast path for (see
 * {@link Operation#hasFastPath}) always go to the full engine.
 * Delegation is under the same context with the simplified option
 * cleared, so conditions reach the same accumulator.
 *
 * @param <T> the number type
 */
public class SimpleRadixMath<T> implements RadixMath<T> {

    /** Logger for the simplified engine. */
    static final Logger logger =
            LoggerFactory.getLogger(SimpleRadixMath.class);

    /** Largest precision (in digits) the fast paths accept. */
    static final int MAX_PRECISION = 18;

    private final FullRadixMath<T> full;
    private final NumberRepresentation<T> rep;
    private final int radix;

    /**
     * Create an engine delegating to the given full engine.
     *
     * @param full engine for everything outside the fast paths
     */
    public SimpleRadixMath(FullRadixMath<T> full) {
        this.full = Objects.requireNonNull(full, "full engine");
        this.rep = full.getRepresentation();
        this.radix = rep.radix();
        logger.atDebug().setMessage("simplified engine for radix {}")
                .addArgument(radix).log();
    }

    @Override
    public NumberRepresentation<T> getRepresentation() { return rep; }

    // Domain of the fast paths --------------------------------------

    /**
     * A finite number small enough for long arithmetic.
     *
     * @param negative sign
     * @param mantissa non-negative, less than 2**62
     * @param exponent within the range of an int
     */
    record Small(boolean negative, long mantissa, long exponent) {}

    /** The operand as a {@link Small}, or {@code null}. */
    private Small small(T x) {
        if (rep.kind(x) != NumberKind.FINITE) { return null; }
        BigInteger m = rep.mantissa(x), e = rep.exponent(x);
        if (m.bitLength() >= 63 || e.bitLength() >= 32) { return null; }
        return new Small(rep.isNegative(x), m.longValue(), e.longValue());
    }

    /** Whether the context is one the fast paths handle. */
    private boolean fast(PrecisionContext c) {
        if (c == null || c.isPrecisionInBits()) { return false; }
        int p = c.getPrecision();
        if (p < 1 || p > MAX_PRECISION || LongArithmetic.pow(radix, p) < 0) {
            return false;
        }
        return !c.hasExponentRange() || (c.getEMin().bitLength() < 32
                && c.getEMax().bitLength() < 32);
    }

    private static PrecisionContext fallback(PrecisionContext ctx) {
        return ctx == null ? null : ctx.withSimplified(false);
    }

    private void declined(Operation op) {
        if (!op.hasFastPath) { throw unexpected(op); }
        logger.atTrace().setMessage("{} declined fast path")
                .addArgument(op.symbol).log();
    }

    private static RadixMathError unexpected(Operation op) {
        return new RadixMathError("no fast path for %s", op.symbol);
    }

    private T deliver(Operation op, PrecisionContext ctx,
            EnumSet<Flag> flags, Small r) {
        T result = rep.finite(r.negative, BigInteger.valueOf(r.mantissa),
                BigInteger.valueOf(r.exponent));
        return Signals.report(op, ctx, flags, result);
    }

    // Rounding ------------------------------------------------------

    /**
     * A mantissa with low digits discarded and rounded.
     *
     * @param q retained digits, rounded
     * @param inexact whether anything non-zero was discarded
     */
    private record Cut(long q, boolean inexact) {}

    /**
     * Discard {@code k} digits of {@code m} and round, as
     * {@link Rounder#round} does.
     *
     * @return the rounded mantissa, or {@code null} if long arithmetic
     *     cannot do it
     */
    private Cut discard(boolean neg, long m, long k, boolean sticky,
            Rounding rounding) {
        long q;
        int half;
        boolean inexact;
        if (k == 0) {
            q = m;
            half = -1;
            inexact = sticky;
        } else if (k > LongArithmetic.digits(m, radix)) {
            q = 0;
            half = -1;
            inexact = sticky || m != 0;
        } else {
            long pk = LongArithmetic.pow(radix, k);
            if (pk < 0) { return null; }
            q = m / pk;
            long r = m % pk;
            half = Long.compare(r, pk - r);
            if (half == 0 && sticky) { half = 1; }
            inexact = sticky || r != 0;
        }
        if (rounding.roundsAway(neg, (q & 1L) != 0, (int)(q % radix), radix,
                half, inexact)) {
            q += 1;
        }
        return new Cut(q, inexact);
    }

    /**
     * Round to the context as {@link Rounder#finish} would, or decline.
     * Conditions are added to {@code f} only if the result is accepted.
     *
     * @return the rounded result, or {@code null} to decline
     */
    private Small round(boolean neg, long m, long e, boolean sticky,
            PrecisionContext c, EnumSet<Flag> f) {
        int p = c.getPrecision();
        int digits = LongArithmetic.digits(m, radix);
        long k = Math.max(0, digits - p);
        Cut cut = discard(neg, m, k, sticky, c.getRounding());
        if (cut == null) { return null; }
        long q = cut.q;
        if (q == LongArithmetic.pow(radix, p)) {
            // Carried out of the top digit
            q /= radix;
            k += 1;
        }
        long ex = e + k;

        if (c.hasExponentRange()) {
            long eMin = c.getEMin().longValue();
            long eMax = c.getEMax().longValue();
            long top = c.isClampNormalExponents() ? eMax - p + 1 : eMax;
            if (m == 0 && !sticky) {
                if (e < eMin - p + 1 || e > top) { return null; }
            } else {
                if (e + digits - 1 < eMin) { return null; }
                if (ex + LongArithmetic.digits(q, radix) - 1 > eMax) {
                    return null;
                }
                if (ex > top) { return null; }
            }
        }

        if (k > 0) { f.add(Flag.ROUNDED); }
        if (cut.inexact) {
            f.add(Flag.INEXACT);
            f.add(Flag.ROUNDED);
        }
        return new Small(neg, q, ex);
    }

    private Small round(Small x, boolean neg, PrecisionContext c,
            EnumSet<Flag> f) {
        return round(neg, x.mantissa, x.exponent, false, c, f);
    }

    /**
     * Give a mantissa an imposed exponent, as the full engine does for
     * quantize, or decline if the result would be invalid or subnormal.
     */
    private Small rescale(Small x, long e, PrecisionContext c,
            EnumSet<Flag> f) {
        long shift = x.exponent - e;
        long q;
        EnumSet<Flag> g = Signals.none();
        if (shift >= 0) {
            q = x.mantissa;
            if (q != 0) {
                long ps = LongArithmetic.pow(radix, shift);
                if (ps < 0 || !LongArithmetic.productFits(q, ps)) {
                    return null;
                }
                q *= ps;
            }
        } else {
            Cut cut = discard(x.negative, x.mantissa, -shift, false,
                    c.getRounding());
            if (cut == null) { return null; }
            q = cut.q;
            if (x.mantissa != 0) { g.add(Flag.ROUNDED); }
            if (cut.inexact) { g.add(Flag.INEXACT); }
        }
        int p = c.getPrecision();
        int digits = LongArithmetic.digits(q, radix);
        if (digits > p) { return null; }
        if (c.hasExponentRange()) {
            long eMin = c.getEMin().longValue();
            long eMax = c.getEMax().longValue();
            long top = c.isClampNormalExponents() ? eMax - p + 1 : eMax;
            if (e > top || e < eMin - p + 1) { return null; }
            if (q != 0 && (e + digits - 1 > eMax || e + digits - 1 < eMin)) {
                return null;
            }
        }
        f.addAll(g);
        return new Small(x.negative, q, e);
    }

    // Comparison helpers --------------------------------------------

    /**
     * Sign of {@code |x| - |y|}, or {@code null} if long arithmetic
     * cannot decide it.
     */
    private Integer compareMagnitude(Small x, Small y) {
        boolean xz = x.mantissa == 0, yz = y.mantissa == 0;
        if (xz || yz) { return xz ? (yz ? 0 : -1) : 1; }
        long ax = x.exponent + LongArithmetic.digits(x.mantissa, radix);
        long ay = y.exponent + LongArithmetic.digits(y.mantissa, radix);
        if (ax != ay) { return ax < ay ? -1 : 1; }
        long mx = x.mantissa, my = y.mantissa;
        long d = x.exponent - y.exponent;
        long pd = LongArithmetic.pow(radix, Math.abs(d));
        if (pd < 0) { return null; }
        if (d > 0) {
            if (!LongArithmetic.productFits(mx, pd)) { return null; }
            mx *= pd;
        } else if (d < 0) {
            if (!LongArithmetic.productFits(my, pd)) { return null; }
            my *= pd;
        }
        return Long.compare(mx, my);
    }

    /** Sign of {@code x - y}, or {@code null} if undecided. */
    private Integer compareValues(Small x, Small y) {
        boolean xz = x.mantissa == 0, yz = y.mantissa == 0;
        if (xz && yz) { return 0; }
        boolean xn = x.negative && !xz, yn = y.negative && !yz;
        if (xn != yn) {
            if (xz) { return yn ? 1 : -1; }
            if (yz) { return xn ? -1 : 1; }
            return xn ? -1 : 1;
        }
        Integer c = compareMagnitude(x, y);
        return c == null ? null : (xn ? -c : c);
    }

    // Arithmetic ----------------------------------------------------

    @Override
    public T add(T x, T y, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            if (a != null && b != null) {
                EnumSet<Flag> f = Signals.none();
                Small r = sum(a, b, ctx, f);
                if (r != null) { return deliver(Operation.ADD, ctx, f, r); }
            }
            declined(Operation.ADD);
        }
        return full.add(x, y, fallback(ctx));
    }

    @Override
    public T addEx(T x, T y, PrecisionContext ctx,
            boolean roundToOperandPrecision) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            if (a != null && b != null) {
                EnumSet<Flag> f = Signals.none();
                if (roundToOperandPrecision) {
                    a = round(a, a.negative, ctx, f);
                    b = a == null ? null : round(b, b.negative, ctx, f);
                }
                Small r = a == null || b == null ? null : sum(a, b, ctx, f);
                if (r != null) {
                    return deliver(Operation.ADD_EX, ctx, f, r);
                }
            }
            declined(Operation.ADD_EX);
        }
        return full.addEx(x, y, fallback(ctx), roundToOperandPrecision);
    }

    /** Rounded sum, or {@code null} to decline. */
    private Small sum(Small a, Small b, PrecisionContext c,
            EnumSet<Flag> f) {
        long ez = Math.min(a.exponent, b.exponent);
        if (a.mantissa == 0 && b.mantissa == 0) {
            boolean neg = a.negative && b.negative
                    || a.negative != b.negative
                            && c.getRounding() == Rounding.FLOOR;
            return round(neg, 0, ez, false, c, f);
        }
        long ma = aligned(a, ez), mb = aligned(b, ez);
        if (ma < 0 || mb < 0) { return null; }
        long sa = a.negative ? -ma : ma, sb = b.negative ? -mb : mb;
        if (!LongArithmetic.sumFits(sa, sb)) { return null; }
        long s = sa + sb;
        if (s == Long.MIN_VALUE) {
            return null;
        } else if (s == 0) {
            return round(c.getRounding() == Rounding.FLOOR, 0, ez, false, c,
                    f);
        }
        return round(s < 0, Math.abs(s), ez, false, c, f);
    }

    /** Mantissa scaled to a lesser exponent, or -1 on overflow. */
    private long aligned(Small x, long e) {
        long ps = LongArithmetic.pow(radix, x.exponent - e);
        if (ps < 0 || !LongArithmetic.productFits(x.mantissa, ps)) {
            return -1L;
        }
        return x.mantissa * ps;
    }

    @Override
    public T multiply(T x, T y, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            if (a != null && b != null
                    && LongArithmetic.productFits(a.mantissa, b.mantissa)) {
                EnumSet<Flag> f = Signals.none();
                Small r = round(a.negative != b.negative,
                        a.mantissa * b.mantissa, a.exponent + b.exponent,
                        false, ctx, f);
                if (r != null) {
                    return deliver(Operation.MULTIPLY, ctx, f, r);
                }
            }
            declined(Operation.MULTIPLY);
        }
        return full.multiply(x, y, fallback(ctx));
    }

    @Override
    public T multiplyAndAdd(T x, T y, T z, PrecisionContext ctx) {
        return full.multiplyAndAdd(x, y, z, fallback(ctx));
    }

    @Override
    public T divide(T x, T y, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            if (a != null && b != null && b.mantissa != 0) {
                EnumSet<Flag> f = Signals.none();
                Small r = quotient(a, b, ctx, f);
                if (r != null) {
                    return deliver(Operation.DIVIDE, ctx, f, r);
                }
            }
            declined(Operation.DIVIDE);
        }
        return full.divide(x, y, fallback(ctx));
    }

    /** Rounded quotient by a non-zero divisor, or {@code null}. */
    private Small quotient(Small a, Small b, PrecisionContext c,
            EnumSet<Flag> f) {
        boolean neg = a.negative != b.negative;
        long ideal = a.exponent - b.exponent;
        if (a.mantissa == 0) { return round(neg, 0, ideal, false, c, f); }
        long s = Math.max(0, c.getPrecision() + 1
                + LongArithmetic.digits(b.mantissa, radix)
                - LongArithmetic.digits(a.mantissa, radix));
        long ps = LongArithmetic.pow(radix, s);
        if (ps < 0 || !LongArithmetic.productFits(a.mantissa, ps)) {
            return null;
        }
        long num = a.mantissa * ps;
        long q = num / b.mantissa, r = num % b.mantissa;
        long e = ideal - s;
        if (r != 0) { return round(neg, q, e, true, c, f); }
        while (e < ideal && q % radix == 0) {
            q /= radix;
            e += 1;
        }
        return round(neg, q, e, false, c, f);
    }

    @Override
    public T divideToExponent(T x, T y, BigInteger exponent,
            PrecisionContext ctx) {
        return full.divideToExponent(x, y, exponent, fallback(ctx));
    }

    @Override
    public T divideToIntegerNaturalScale(T x, T y, PrecisionContext ctx) {
        return full.divideToIntegerNaturalScale(x, y, fallback(ctx));
    }

    @Override
    public T divideToIntegerZeroScale(T x, T y, PrecisionContext ctx) {
        return full.divideToIntegerZeroScale(x, y, fallback(ctx));
    }

    @Override
    public T remainder(T x, T y, PrecisionContext ctx) {
        return full.remainder(x, y, fallback(ctx));
    }

    @Override
    public T remainderNear(T x, T y, PrecisionContext ctx) {
        return full.remainderNear(x, y, fallback(ctx));
    }

    @Override
    public T negate(T x, PrecisionContext ctx) {
        return unaryOrFull(Operation.NEGATE, x, ctx);
    }

    @Override
    public T abs(T x, PrecisionContext ctx) {
        return unaryOrFull(Operation.ABS, x, ctx);
    }

    @Override
    public T roundToPrecision(T x, PrecisionContext ctx) {
        return unaryOrFull(Operation.ROUND_TO_PRECISION, x, ctx);
    }

    @Override
    public T plus(T x, PrecisionContext ctx) {
        return unaryOrFull(Operation.PLUS, x, ctx);
    }

    /**
     * The operations that round a single operand, perhaps changing its
     * sign first.
     */
    T unaryOrFull(Operation op, T x, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x);
            if (a != null) {
                EnumSet<Flag> f = Signals.none();
                boolean neg = switch (op) {
                    case NEGATE -> !a.negative;
                    case ABS -> false;
                    case PLUS, ROUND_TO_PRECISION -> a.negative;
                    default -> throw unexpected(op);
                };
                Small r = round(a, neg, ctx, f);
                if (r != null) {
                    if (op == Operation.PLUS && r.mantissa == 0
                            && r.negative
                            && ctx.getRounding() != Rounding.FLOOR) {
                        r = new Small(false, 0, r.exponent);
                    }
                    return deliver(op, ctx, f, r);
                }
            }
            declined(op);
        }
        PrecisionContext c = fallback(ctx);
        return switch (op) {
            case NEGATE -> full.negate(x, c);
            case ABS -> full.abs(x, c);
            case PLUS -> full.plus(x, c);
            case ROUND_TO_PRECISION -> full.roundToPrecision(x, c);
            default -> throw unexpected(op);
        };
    }

    // Comparison ----------------------------------------------------

    @Override
    public T compareToWithContext(T x, T y,
            boolean treatQuietNansAsSignaling, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            Integer c = a == null || b == null ? null : compareValues(a, b);
            if (c != null) { return rep.valueOf(c); }
            declined(Operation.COMPARE_TO_WITH_CONTEXT);
        }
        return full.compareToWithContext(x, y, treatQuietNansAsSignaling,
                fallback(ctx));
    }

    @Override
    public int compareTo(T x, T y) { return full.compareTo(x, y); }

    @Override
    public T min(T x, T y, PrecisionContext ctx) {
        return chooseOrFull(Operation.MIN, x, y, ctx);
    }

    @Override
    public T max(T x, T y, PrecisionContext ctx) {
        return chooseOrFull(Operation.MAX, x, y, ctx);
    }

    @Override
    public T minMagnitude(T x, T y, PrecisionContext ctx) {
        return chooseOrFull(Operation.MIN_MAGNITUDE, x, y, ctx);
    }

    @Override
    public T maxMagnitude(T x, T y, PrecisionContext ctx) {
        return chooseOrFull(Operation.MAX_MAGNITUDE, x, y, ctx);
    }

    /** Minimum and maximum, by value or magnitude. */
    T chooseOrFull(Operation op, T x, T y, PrecisionContext ctx) {
        switch (op) {
            case MIN:
            case MAX:
            case MIN_MAGNITUDE:
            case MAX_MAGNITUDE:
                break;
            default:
                throw unexpected(op);
        }
        boolean max = op == Operation.MAX || op == Operation.MAX_MAGNITUDE;
        boolean magnitude = op == Operation.MIN_MAGNITUDE
                || op == Operation.MAX_MAGNITUDE;
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            Small chosen = a == null || b == null ? null
                    : choose(a, b, max, magnitude);
            if (chosen != null) {
                EnumSet<Flag> f = Signals.none();
                Small r = round(chosen, chosen.negative, ctx, f);
                if (r != null) { return deliver(op, ctx, f, r); }
            }
            declined(op);
        }
        PrecisionContext c = fallback(ctx);
        return switch (op) {
            case MIN -> full.min(x, y, c);
            case MAX -> full.max(x, y, c);
            case MIN_MAGNITUDE -> full.minMagnitude(x, y, c);
            case MAX_MAGNITUDE -> full.maxMagnitude(x, y, c);
            default -> throw unexpected(op);
        };
    }

    /** The operand chosen, or {@code null} if undecided. */
    private Small choose(Small a, Small b, boolean max, boolean magnitude) {
        if (magnitude) {
            Integer m = compareMagnitude(a, b);
            if (m == null) { return null; }
            if (m != 0) { return (max ? m > 0 : m < 0) ? a : b; }
        }
        Integer cmp = compareValues(a, b);
        if (cmp == null) { return null; }
        int expCmp = Long.compare(a.exponent, b.exponent);
        boolean left = max
                ? Ordering.maxIsLeft(cmp, a.negative, b.negative, expCmp)
                : Ordering.minIsLeft(cmp, a.negative, b.negative, expCmp);
        return left ? a : b;
    }

    // Rounding and quantization -------------------------------------

    @Override
    public T roundToBinaryPrecision(T x, PrecisionContext ctx) {
        return full.roundToBinaryPrecision(x, fallback(ctx));
    }

    @Override
    public T roundAfterConversion(T x, PrecisionContext ctx) {
        return full.roundAfterConversion(x, fallback(ctx));
    }

    @Override
    public T quantize(T x, T y, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x), b = small(y);
            if (a != null && b != null) {
                EnumSet<Flag> f = Signals.none();
                Small r = rescale(a, b.exponent, ctx, f);
                if (r != null) {
                    return deliver(Operation.QUANTIZE, ctx, f, r);
                }
            }
            declined(Operation.QUANTIZE);
        }
        return full.quantize(x, y, fallback(ctx));
    }

    @Override
    public T roundToExponentExact(T x, BigInteger exponent,
            PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        if (fast(ctx)) {
            Small r = toExponent(x, exponent, false, ctx, f);
            if (r != null) {
                return deliver(Operation.ROUND_TO_EXPONENT_EXACT, ctx, f, r);
            }
            declined(Operation.ROUND_TO_EXPONENT_EXACT);
        }
        return full.roundToExponentExact(x, exponent, fallback(ctx));
    }

    @Override
    public T roundToExponentSimple(T x, BigInteger exponent,
            PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        if (fast(ctx)) {
            Small r = toExponent(x, exponent, true, ctx, f);
            if (r != null) {
                return deliver(Operation.ROUND_TO_EXPONENT_SIMPLE, ctx, f,
                        r);
            }
            declined(Operation.ROUND_TO_EXPONENT_SIMPLE);
        }
        return full.roundToExponentSimple(x, exponent, fallback(ctx));
    }

    @Override
    public T roundToExponentNoRoundedFlag(T x, BigInteger exponent,
            PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        if (fast(ctx)) {
            Small r = toExponent(x, exponent, false, ctx, f);
            if (r != null) {
                f.remove(Flag.INEXACT);
                f.remove(Flag.ROUNDED);
                return deliver(Operation.ROUND_TO_EXPONENT_NO_ROUNDED_FLAG,
                        ctx, f, r);
            }
            declined(Operation.ROUND_TO_EXPONENT_NO_ROUNDED_FLAG);
        }
        return full.roundToExponentNoRoundedFlag(x, exponent,
                fallback(ctx));
    }

    /**
     * Round to an exponent, as {@link FullRadixMath} does, or decline.
     */
    private Small toExponent(T x, BigInteger exponent, boolean simple,
            PrecisionContext c, EnumSet<Flag> f) {
        Small a = small(x);
        if (a == null || exponent.bitLength() >= 32) { return null; }
        long e = exponent.longValue();
        if (a.exponent >= e) {
            return round(a, a.negative, c, f);
        } else if (!simple) {
            return rescale(a, e, c, f);
        }
        Cut cut = discard(a.negative, a.mantissa, e - a.exponent, false,
                c.getRounding());
        if (cut == null) { return null; }
        EnumSet<Flag> g = Signals.none();
        g.add(Flag.ROUNDED);
        if (cut.inexact) { g.add(Flag.INEXACT); }
        Small r = round(a.negative, cut.q, e, false, c, g);
        if (r != null) { f.addAll(g); }
        return r;
    }

    @Override
    public T reduce(T x, PrecisionContext ctx) {
        if (fast(ctx)) {
            Small a = small(x);
            if (a != null) {
                EnumSet<Flag> f = Signals.none();
                Small r = round(a, a.negative, ctx, f);
                if (r != null) {
                    return deliver(Operation.REDUCE, ctx, f, stripped(r, ctx));
                }
            }
            declined(Operation.REDUCE);
        }
        return full.reduce(x, fallback(ctx));
    }

    /** Trailing zeros removed, within the exponent range. */
    private Small stripped(Small r, PrecisionContext c) {
        if (r.mantissa == 0) { return new Small(r.negative, 0, 0); }
        long limit = Long.MAX_VALUE;
        if (c.hasExponentRange()) {
            long eMax = c.getEMax().longValue();
            limit = c.isClampNormalExponents()
                    ? eMax - c.getPrecision() + 1 : eMax;
        }
        long m = r.mantissa, e = r.exponent;
        while (m % radix == 0 && e < limit) {
            m /= radix;
            e += 1;
        }
        return new Small(r.negative, m, e);
    }

    // Navigation and elementary functions ---------------------------

    @Override
    public T nextMinus(T x, PrecisionContext ctx) {
        return full.nextMinus(x, fallback(ctx));
    }

    @Override
    public T nextPlus(T x, PrecisionContext ctx) {
        return full.nextPlus(x, fallback(ctx));
    }

    @Override
    public T nextToward(T x, T y, PrecisionContext ctx) {
        return full.nextToward(x, y, fallback(ctx));
    }

    @Override
    public T pi(PrecisionContext ctx) {
        Objects.requireNonNull(ctx, "pi requires a precision context");
        return full.pi(fallback(ctx));
    }

    @Override
    public T power(T x, T y, PrecisionContext ctx) {
        return full.power(x, y, fallback(ctx));
    }

    @Override
    public T log10(T x, PrecisionContext ctx) {
        return full.log10(x, fallback(ctx));
    }

    @Override
    public T ln(T x, PrecisionContext ctx) {
        return full.ln(x, fallback(ctx));
    }

    @Override
    public T exp(T x, PrecisionContext ctx) {
        return full.exp(x, fallback(ctx));
    }

    @Override
    public T squareRoot(T x, PrecisionContext ctx) {
        return full.squareRoot(x, fallback(ctx));
    }
}
