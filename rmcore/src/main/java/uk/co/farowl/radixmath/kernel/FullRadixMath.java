// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.Objects;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.radixmath.Flag;
import uk.co.farowl.radixmath.NumberRepresentation;
import uk.co.farowl.radixmath.Operation;
import uk.co.farowl.radixmath.PrecisionContext;
import uk.co.farowl.radixmath.RadixMath;
import uk.co.farowl.radixmath.Rounding;

/**
 * The arithmetic engine for the whole domain: any radix, any precision,
 * any exponent range, all special values and all operations. Mantissas
 * and exponents are {@code BigInteger}s throughout.
 * <p>
 * Each public operation takes its operands apart into {@link Operand}s,
 * works out the exact result (or enough of it, with a sticky digit),
 * rounds once through a {@link Rounder}, and reports the conditions it
 * raised through {@link Signals#report}. The internal methods that do
 * the work collect conditions in a local set and never trap, so that
 * one operation may be built from others.
 *
 * @param <T> the number type
 */
public class FullRadixMath<T> implements RadixMath<T> {

    /** Logger for the full engine. */
    static final Logger logger = LoggerFactory.getLogger(FullRadixMath.class);

    /** Times the working precision of an approximation may double. */
    private static final int ZIV_LIMIT = 16;

    /** Extra digits in the first approximation of a function. */
    private static final int ZIV_GUARD = 8;

    /**
     * Largest adjusted exponent of an argument to {@code exp} allowed
     * when the exponent range is unlimited.
     */
    private static final long EXP_ARGUMENT_DIGITS = 1000;

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final NumberRepresentation<T> rep;
    final Radix radix;
    final Rounder rounder;
    private final Elementary elementary;

    /**
     * Create an engine for the numbers of the given representation.
     *
     * @param rep the representation
     */
    public FullRadixMath(NumberRepresentation<T> rep) {
        this.rep = Objects.requireNonNull(rep, "representation");
        this.radix = new Radix(rep.radix());
        this.rounder = new Rounder(radix);
        this.elementary = new Elementary(radix);
        logger.atDebug().setMessage("full engine for radix {}")
                .addArgument(radix.radix).log();
    }

    @Override
    public NumberRepresentation<T> getRepresentation() { return rep; }

    private Operand in(T x) { return Operand.of(rep, x); }

    private T deliver(Operation op, PrecisionContext ctx,
            EnumSet<Flag> flags, Operand r) {
        return Signals.report(op, ctx, flags, r.to(rep));
    }

    private static PrecisionContext resolve(PrecisionContext ctx) {
        return PrecisionContext.orDefault(ctx);
    }

    /** Digits of working precision equivalent to the context's. */
    private long precisionDigits(PrecisionContext c) {
        return radix.digitsFor(c.getPrecision(), c.isPrecisionInBits());
    }

    // Special values ------------------------------------------------

    /**
     * The result of an operation on these operands if any is a NaN:
     * the first signaling NaN made quiet (raising {@code INVALID}), or
     * else the first quiet NaN.
     *
     * @param flags to which raised conditions are added
     * @param ops operands in order
     * @return NaN result or {@code null} if no operand is a NaN
     */
    private static Operand nanResult(EnumSet<Flag> flags, Operand... ops) {
        for (Operand o : ops) {
            if (o.isSignaling()) {
                flags.add(Flag.INVALID);
                return o.quiet();
            }
        }
        for (Operand o : ops) {
            if (o.isQuietNaN()) { return o; }
        }
        return null;
    }

    private static Operand invalid(EnumSet<Flag> flags) {
        flags.add(Flag.INVALID);
        return Operand.NAN;
    }

    /** Round a finite operand; an infinity passes unchanged. */
    private Operand rounded(Operand x, PrecisionContext c,
            EnumSet<Flag> flags) {
        return x.isFinite() ? rounder.finish(x, c, flags) : x;
    }

    /** Whether a finite operand has the value one exactly. */
    private boolean isOne(Operand x) {
        if (!x.isFinite() || x.negative() || x.mantissa().signum() == 0) {
            return false;
        }
        BigInteger[] me = radix.stripZeros(x.mantissa(), x.exponent(), null);
        return me[0].equals(BigInteger.ONE) && me[1].signum() == 0;
    }

    // Arithmetic ----------------------------------------------------

    @Override
    public T add(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = add(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.ADD, ctx, f, r);
    }

    @Override
    public T addEx(T x, T y, PrecisionContext ctx,
            boolean roundToOperandPrecision) {
        EnumSet<Flag> f = Signals.none();
        PrecisionContext c = resolve(ctx);
        Operand a = in(x), b = in(y);
        if (roundToOperandPrecision && c.hasMaxPrecision()) {
            a = rounded(a, c, f);
            b = rounded(b, c, f);
        }
        Operand r = add(a, b, c, f);
        return deliver(Operation.ADD_EX, ctx, f, r);
    }

    Operand add(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) {
            return n;
        } else if (x.isInfinite()) {
            if (y.isInfinite() && x.negative() != y.negative()) {
                return invalid(f);
            }
            return x;
        } else if (y.isInfinite()) {
            return y;
        }
        return rounder.finish(exactSum(x, y, c), c, f);
    }

    /**
     * The exact sum of two finite operands, except that an operand
     * entirely below the rounding digit of the other may be replaced by
     * a smaller non-zero one, which rounds the same way.
     */
    private Operand exactSum(Operand x, Operand y, PrecisionContext c) {
        BigInteger ex = x.exponent(), ey = y.exponent();
        if (x.isZero() && y.isZero()) {
            boolean neg = x.negative() && y.negative()
                    || x.negative() != y.negative()
                            && c.getRounding() == Rounding.FLOOR;
            return Operand.zero(neg, ex.min(ey));
        }

        if (c.hasMaxPrecision() && radix.radix % 2 == 0 && !x.isZero()
                && !y.isZero()) {
            BigInteger ax = x.adjusted(radix), ay = y.adjusted(radix);
            boolean xBig = ax.compareTo(ay) >= 0;
            Operand big = xBig ? x : y, small = xBig ? y : x;
            BigInteger t = (xBig ? ax : ay)
                    .subtract(BigInteger.valueOf(precisionDigits(c) + 3));
            if ((xBig ? ay : ax).compareTo(t) < 0
                    && big.exponent().compareTo(t) >= 0) {
                small = Operand.finite(small.negative(), BigInteger.ONE,
                        t.subtract(BigInteger.ONE));
                if (xBig) {
                    y = small;
                    ey = small.exponent();
                } else {
                    x = small;
                    ex = small.exponent();
                }
            }
        }

        BigInteger ez = ex.min(ey);
        BigInteger mx = x.mantissa().multiply(radix.pow(ex.subtract(ez)));
        BigInteger my = y.mantissa().multiply(radix.pow(ey.subtract(ez)));
        BigInteger sum = (x.negative() ? mx.negate() : mx)
                .add(y.negative() ? my.negate() : my);
        if (sum.signum() == 0) {
            return Operand.zero(c.getRounding() == Rounding.FLOOR, ez);
        }
        return Operand.finite(sum.signum() < 0, sum.abs(), ez);
    }

    @Override
    public T multiply(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = multiply(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.MULTIPLY, ctx, f, r);
    }

    Operand multiply(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) { return n; }
        boolean neg = x.negative() != y.negative();
        if (x.isInfinite() || y.isInfinite()) {
            if (x.isZero() || y.isZero()) { return invalid(f); }
            return Operand.infinity(neg);
        }
        return rounder.finish(neg, x.mantissa().multiply(y.mantissa()),
                x.exponent().add(y.exponent()), false, c, f);
    }

    @Override
    public T multiplyAndAdd(T x, T y, T z, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand a = in(x), b = in(y), d = in(z);
        Operand r = nanResult(f, a, b, d);
        if (r == null) {
            r = multiply(a, b, PrecisionContext.UNLIMITED, f);
            if (!r.isNaN()) { r = add(r, d, resolve(ctx), f); }
        }
        return deliver(Operation.MULTIPLY_AND_ADD, ctx, f, r);
    }

    @Override
    public T divide(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = divide(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.DIVIDE, ctx, f, r);
    }

    Operand divide(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) { return n; }
        boolean neg = x.negative() != y.negative();
        if (x.isInfinite()) {
            return y.isInfinite() ? invalid(f) : Operand.infinity(neg);
        } else if (y.isInfinite()) {
            if (c.hasExponentRange() && c.hasMaxPrecision()) {
                f.add(Flag.CLAMPED);
            }
            return Operand.zero(neg, rounder.tinyExponent(c));
        } else if (y.isZero()) {
            if (x.isZero()) { return invalid(f); }
            f.add(Flag.DIVIDE_BY_ZERO);
            return Operand.infinity(neg);
        }

        BigInteger ideal = x.exponent().subtract(y.exponent());
        if (x.isZero()) {
            return rounder.finish(neg, BigInteger.ZERO, ideal, false, c, f);
        }
        BigInteger mx = x.mantissa(), my = y.mantissa();

        if (!c.hasMaxPrecision()) {
            // The quotient must terminate: find how many digits it takes
            BigInteger g = mx.gcd(my);
            BigInteger num = mx.divide(g), den = my.divide(g);
            long k = radix.terminatingDigits(den);
            if (k < 0) { return invalid(f); }
            BigInteger q = num.multiply(radix.pow(k)).divide(den);
            BigInteger[] qe = radix.stripZeros(q,
                    ideal.subtract(BigInteger.valueOf(k)), ideal);
            return rounder.finish(neg, qe[0], qe[1], false, c, f);
        }

        // Enough digits that the quotient has at least p+1 of them
        long s = Math.max(0L, precisionDigits(c) + 1 + radix.digits(my)
                - radix.digits(mx));
        BigInteger[] qr = mx.multiply(radix.pow(s)).divideAndRemainder(my);
        BigInteger e = ideal.subtract(BigInteger.valueOf(s));
        if (qr[1].signum() == 0) {
            BigInteger[] qe = radix.stripZeros(qr[0], e, ideal);
            return rounder.finish(neg, qe[0], qe[1], false, c, f);
        }
        return rounder.finish(neg, qr[0], e, true, c, f);
    }

    @Override
    public T divideToExponent(T x, T y, BigInteger exponent,
            PrecisionContext ctx) {
        Objects.requireNonNull(exponent, "exponent");
        EnumSet<Flag> f = Signals.none();
        Operand r = divideToExponent(in(x), in(y), exponent, resolve(ctx),
                f);
        return deliver(Operation.DIVIDE_TO_EXPONENT, ctx, f, r);
    }

    Operand divideToExponent(Operand x, Operand y, BigInteger e,
            PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) { return n; }
        boolean neg = x.negative() != y.negative();
        if (x.isInfinite()) {
            return y.isInfinite() ? invalid(f) : Operand.infinity(neg);
        } else if (y.isInfinite()) {
            return checkQuantized(neg, BigInteger.ZERO, e, false,
                    Signals.none(), c, f);
        } else if (y.isZero()) {
            if (x.isZero()) { return invalid(f); }
            f.add(Flag.DIVIDE_BY_ZERO);
            return Operand.infinity(neg);
        }

        BigInteger shift = x.exponent().subtract(y.exponent()).subtract(e);
        BigInteger num = x.mantissa(), den = y.mantissa();
        if (shift.signum() >= 0) {
            num = num.multiply(radix.pow(shift));
        } else {
            den = den.multiply(radix.pow(shift.negate()));
        }
        BigInteger[] qr = num.divideAndRemainder(den);
        boolean inexact = qr[1].signum() != 0;
        int half = qr[1].shiftLeft(1).compareTo(den);
        BigInteger q = qr[0];
        if (c.getRounding().roundsAway(neg, q.testBit(0),
                radix.lastDigit(q), radix.radix, half, inexact)) {
            q = q.add(BigInteger.ONE);
        }
        EnumSet<Flag> g = Signals.none();
        if (inexact) {
            g.add(Flag.INEXACT);
            g.add(Flag.ROUNDED);
        }
        return checkQuantized(neg, q, e, inexact, g, c, f);
    }

    /**
     * Accept a result whose exponent was imposed, or declare it invalid
     * if the mantissa is too wide or the exponent out of range.
     *
     * @param neg sign
     * @param q mantissa
     * @param e imposed exponent
     * @param inexact whether non-zero digits were discarded
     * @param g conditions raised so far, reported only on success
     * @param c context
     * @param f to which raised conditions are added
     * @return the result or a NaN
     */
    private Operand checkQuantized(boolean neg, BigInteger q, BigInteger e,
            boolean inexact, EnumSet<Flag> g, PrecisionContext c,
            EnumSet<Flag> f) {
        if (!rounder.fits(q, c)) { return invalid(f); }
        if (c.hasExponentRange()) {
            if (e.compareTo(rounder.eTop(c)) > 0) { return invalid(f); }
            if (c.hasMaxPrecision() && e.compareTo(rounder.eTiny(c)) < 0) {
                return invalid(f);
            }
            if (q.signum() != 0) {
                BigInteger adj =
                        e.add(BigInteger.valueOf(radix.digits(q) - 1));
                if (adj.compareTo(c.getEMax()) > 0) { return invalid(f); }
                if (adj.compareTo(c.getEMin()) < 0) {
                    g.add(Flag.SUBNORMAL);
                    if (inexact) { g.add(Flag.UNDERFLOW); }
                }
            }
        }
        f.addAll(g);
        return Operand.finite(neg, q, e);
    }

    @Override
    public T divideToIntegerNaturalScale(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = divideToInteger(in(x), in(y), true, resolve(ctx), f);
        return deliver(Operation.DIVIDE_TO_INTEGER_NATURAL_SCALE, ctx, f,
                r);
    }

    @Override
    public T divideToIntegerZeroScale(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = divideToInteger(in(x), in(y), false, resolve(ctx), f);
        return deliver(Operation.DIVIDE_TO_INTEGER_ZERO_SCALE, ctx, f, r);
    }

    /**
     * Whether the integer quotient of two finite non-zero operands
     * certainly has more digits than the precision allows.
     */
    private boolean quotientTooWide(Operand x, Operand y,
            PrecisionContext c) {
        if (!c.hasMaxPrecision()) { return false; }
        BigInteger d = x.adjusted(radix).subtract(y.adjusted(radix));
        return d.compareTo(BigInteger.valueOf(precisionDigits(c) + 2)) > 0;
    }

    /**
     * Finite operands brought to a common exponent, the lesser of the
     * two.
     *
     * @return the mantissas and the common exponent
     */
    private BigInteger[] aligned(Operand x, Operand y) {
        BigInteger ex = x.exponent(), ey = y.exponent();
        BigInteger ez = ex.min(ey);
        return new BigInteger[] {
                x.mantissa().multiply(radix.pow(ex.subtract(ez))),
                y.mantissa().multiply(radix.pow(ey.subtract(ez))), ez};
    }

    Operand divideToInteger(Operand x, Operand y, boolean natural,
            PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) { return n; }
        boolean neg = x.negative() != y.negative();
        if (x.isInfinite()) {
            return y.isInfinite() ? invalid(f) : Operand.infinity(neg);
        }
        BigInteger ideal = x.exponent().subtract(y.exponent());
        if (y.isInfinite()) {
            return rounder.finish(neg, BigInteger.ZERO,
                    natural ? ideal : BigInteger.ZERO, false, c, f);
        } else if (y.isZero()) {
            if (x.isZero()) { return invalid(f); }
            f.add(Flag.DIVIDE_BY_ZERO);
            return Operand.infinity(neg);
        } else if (x.isZero()) {
            return rounder.finish(neg, BigInteger.ZERO,
                    natural ? ideal : BigInteger.ZERO, false, c, f);
        } else if (quotientTooWide(x, y, c)) {
            return invalid(f);
        }

        BigInteger[] xyz = aligned(x, y);
        BigInteger q = xyz[0].divide(xyz[1]);
        BigInteger e = BigInteger.ZERO;
        if (natural) {
            if (q.signum() == 0) {
                e = ideal;
            } else if (ideal.signum() > 0) {
                BigInteger[] qe = radix.stripZeros(q, e, ideal);
                q = qe[0];
                e = qe[1];
            } else if (ideal.signum() < 0) {
                long pad = ideal.negate().min(BigInteger.valueOf(
                        Integer.MAX_VALUE)).longValue();
                if (c.hasMaxPrecision()) {
                    pad = Math.min(pad,
                            precisionDigits(c) - radix.digits(q));
                }
                if (pad > 0) {
                    q = q.multiply(radix.pow(pad));
                    e = BigInteger.valueOf(-pad);
                }
            }
        }
        if (!rounder.fits(q, c)) { return invalid(f); }
        return rounder.finish(neg, q, e, false, c, f);
    }

    @Override
    public T remainder(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = remainder(in(x), in(y), false, resolve(ctx), f);
        return deliver(Operation.REMAINDER, ctx, f, r);
    }

    @Override
    public T remainderNear(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = remainder(in(x), in(y), true, resolve(ctx), f);
        return deliver(Operation.REMAINDER_NEAR, ctx, f, r);
    }

    Operand remainder(Operand x, Operand y, boolean near,
            PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) {
            return n;
        } else if (x.isInfinite() || y.isZero()) {
            return invalid(f);
        } else if (y.isInfinite()) {
            return rounder.finish(x, c, f);
        } else if (x.isZero()) {
            return rounder.finish(x.negative(), BigInteger.ZERO,
                    x.exponent().min(y.exponent()), false, c, f);
        } else if (quotientTooWide(x, y, c)) {
            return invalid(f);
        }

        BigInteger[] xyz = aligned(x, y);
        BigInteger[] qr = xyz[0].divideAndRemainder(xyz[1]);
        BigInteger q = qr[0], r = qr[1];
        boolean neg = x.negative();
        if (near) {
            int half = r.shiftLeft(1).compareTo(xyz[1]);
            if (half > 0 || half == 0 && q.testBit(0)) {
                r = xyz[1].subtract(r);
                q = q.add(BigInteger.ONE);
                neg = !neg;
            }
        }
        if (!rounder.fits(q, c)) { return invalid(f); }
        if (r.signum() == 0) { neg = x.negative(); }
        return rounder.finish(neg, r, xyz[2], false, c, f);
    }

    @Override
    public T negate(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand a = in(x);
        Operand r = nanResult(f, a);
        if (r == null) { r = rounded(a.negate(), resolve(ctx), f); }
        return deliver(Operation.NEGATE, ctx, f, r);
    }

    @Override
    public T abs(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand a = in(x);
        Operand r = nanResult(f, a);
        if (r == null) { r = rounded(a.withSign(false), resolve(ctx), f); }
        return deliver(Operation.ABS, ctx, f, r);
    }

    // Comparison ----------------------------------------------------

    @Override
    public T compareToWithContext(T x, T y,
            boolean treatQuietNansAsSignaling, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand a = in(x), b = in(y);
        Operand r = nanResult(f, a, b);
        if (r != null) {
            if (treatQuietNansAsSignaling) { f.add(Flag.INVALID); }
        } else {
            r = Operand.valueOf(Ordering.compareValues(a, b, radix));
        }
        return deliver(Operation.COMPARE_TO_WITH_CONTEXT, ctx, f, r);
    }

    @Override
    public int compareTo(T x, T y) {
        Operand a = in(x), b = in(y);
        boolean an = a.isNaN(), bn = b.isNaN();
        if (an || bn) { return an ? (bn ? 0 : 1) : -1; }
        return Ordering.compareValues(a, b, radix);
    }

    @Override
    public T min(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = choose(in(x), in(y), false, false, resolve(ctx), f);
        return deliver(Operation.MIN, ctx, f, r);
    }

    @Override
    public T max(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = choose(in(x), in(y), true, false, resolve(ctx), f);
        return deliver(Operation.MAX, ctx, f, r);
    }

    @Override
    public T minMagnitude(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = choose(in(x), in(y), false, true, resolve(ctx), f);
        return deliver(Operation.MIN_MAGNITUDE, ctx, f, r);
    }

    @Override
    public T maxMagnitude(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = choose(in(x), in(y), true, true, resolve(ctx), f);
        return deliver(Operation.MAX_MAGNITUDE, ctx, f, r);
    }

    /**
     * Minimum or maximum, by value or by magnitude.
     *
     * @param x left operand
     * @param y right operand
     * @param max whether to choose the greater
     * @param magnitude whether to compare magnitudes first
     * @param c context
     * @param f to which raised conditions are added
     * @return chosen operand, rounded
     */
    Operand choose(Operand x, Operand y, boolean max, boolean magnitude,
            PrecisionContext c, EnumSet<Flag> f) {
        if (x.isSignaling() || y.isSignaling()) {
            f.add(Flag.INVALID);
            return (x.isSignaling() ? x : y).quiet();
        } else if (x.isQuietNaN()) {
            return y.isQuietNaN() ? x : rounded(y, c, f);
        } else if (y.isQuietNaN()) {
            return rounded(x, c, f);
        }
        if (magnitude) {
            int m = Ordering.compareMagnitude(x, y, radix);
            if (m != 0) {
                return rounded((max ? m > 0 : m < 0) ? x : y, c, f);
            }
        }
        int cmp = Ordering.compareValues(x, y, radix);
        int expCmp = x.exponent().compareTo(y.exponent());
        boolean left = max
                ? Ordering.maxIsLeft(cmp, x.negative(), y.negative(),
                        expCmp)
                : Ordering.minIsLeft(cmp, x.negative(), y.negative(),
                        expCmp);
        return rounded(left ? x : y, c, f);
    }

    // Rounding and quantization -------------------------------------

    @Override
    public T roundToPrecision(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = roundToPrecision(in(x), resolve(ctx), f);
        return deliver(Operation.ROUND_TO_PRECISION, ctx, f, r);
    }

    Operand roundToPrecision(Operand x, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        return n != null ? n : rounded(x, c, f);
    }

    @Override
    public T roundToBinaryPrecision(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = roundToPrecision(in(x),
                resolve(ctx).withPrecisionInBits(true), f);
        return deliver(Operation.ROUND_TO_BINARY_PRECISION, ctx, f, r);
    }

    @Override
    public T roundAfterConversion(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        PrecisionContext c = resolve(ctx);
        Operand a = in(x), r;
        if (a.isNaN()) {
            BigInteger payload = a.mantissa();
            if (c.hasMaxPrecision()) {
                BigInteger limit = radix.pow(precisionDigits(c));
                if (payload.compareTo(limit) >= 0) {
                    payload = payload.mod(limit);
                }
            }
            r = new Operand(a.negative(), payload, BigInteger.ZERO,
                    a.kind());
        } else {
            r = rounded(a, c, f);
        }
        return deliver(Operation.ROUND_AFTER_CONVERSION, ctx, f, r);
    }

    @Override
    public T plus(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        PrecisionContext c = resolve(ctx);
        Operand r = roundToPrecision(in(x), c, f);
        if (r.isZero() && r.negative()
                && c.getRounding() != Rounding.FLOOR) {
            r = r.withSign(false);
        }
        return deliver(Operation.PLUS, ctx, f, r);
    }

    @Override
    public T quantize(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = quantize(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.QUANTIZE, ctx, f, r);
    }

    Operand quantize(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) {
            return n;
        } else if (x.isInfinite() || y.isInfinite()) {
            return x.isInfinite() && y.isInfinite() ? x : invalid(f);
        }
        return rescale(x, y.exponent(), c, f);
    }

    /**
     * A finite operand given a new exponent, rounding if digits are
     * lost, or a NaN if the result does not fit the context.
     */
    private Operand rescale(Operand x, BigInteger e, PrecisionContext c,
            EnumSet<Flag> f) {
        BigInteger m = x.mantissa();
        BigInteger shift = x.exponent().subtract(e);
        EnumSet<Flag> g = Signals.none();
        boolean inexact = false;
        if (shift.signum() >= 0) {
            if (m.signum() != 0) {
                if (c.hasMaxPrecision() && shift.add(BigInteger.valueOf(
                        radix.digits(m))).compareTo(BigInteger
                                .valueOf(precisionDigits(c) + 1)) > 0) {
                    return invalid(f);
                }
                m = m.multiply(radix.pow(shift));
            }
        } else {
            Rounder.Rounded r = rounder.round(m, shift.negate(), false,
                    x.negative(), c.getRounding());
            // A zero loses no digits
            if (m.signum() != 0) { g.add(Flag.ROUNDED); }
            m = r.mantissa();
            inexact = r.inexact();
            if (inexact) { g.add(Flag.INEXACT); }
        }
        return checkQuantized(x.negative(), m, e, inexact, g, c, f);
    }

    @Override
    public T roundToExponentExact(T x, BigInteger exponent,
            PrecisionContext ctx) {
        Objects.requireNonNull(exponent, "exponent");
        EnumSet<Flag> f = Signals.none();
        Operand r = roundToExponent(in(x), exponent, false, resolve(ctx), f);
        return deliver(Operation.ROUND_TO_EXPONENT_EXACT, ctx, f, r);
    }

    @Override
    public T roundToExponentSimple(T x, BigInteger exponent,
            PrecisionContext ctx) {
        Objects.requireNonNull(exponent, "exponent");
        EnumSet<Flag> f = Signals.none();
        Operand r = roundToExponent(in(x), exponent, true, resolve(ctx), f);
        return deliver(Operation.ROUND_TO_EXPONENT_SIMPLE, ctx, f, r);
    }

    @Override
    public T roundToExponentNoRoundedFlag(T x, BigInteger exponent,
            PrecisionContext ctx) {
        Objects.requireNonNull(exponent, "exponent");
        EnumSet<Flag> f = Signals.none();
        Operand r = roundToExponent(in(x), exponent, false, resolve(ctx), f);
        f.remove(Flag.INEXACT);
        f.remove(Flag.ROUNDED);
        return deliver(Operation.ROUND_TO_EXPONENT_NO_ROUNDED_FLAG, ctx, f,
                r);
    }

    /**
     * Round to an exponent if that is greater than the operand's,
     * otherwise to the precision.
     *
     * @param x operand
     * @param e target exponent
     * @param simple whether a result too wide for the context is
     *     rounded again rather than invalid
     * @param c context
     * @param f to which raised conditions are added
     * @return rounded operand
     */
    Operand roundToExponent(Operand x, BigInteger e, boolean simple,
            PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        if (n != null) {
            return n;
        } else if (x.isInfinite()) {
            return x;
        } else if (x.exponent().compareTo(e) >= 0) {
            return rounder.finish(x, c, f);
        } else if (!simple) {
            return rescale(x, e, c, f);
        }
        Rounder.Rounded r = rounder.round(x.mantissa(),
                e.subtract(x.exponent()), false, x.negative(),
                c.getRounding());
        f.add(Flag.ROUNDED);
        if (r.inexact()) { f.add(Flag.INEXACT); }
        return rounder.finish(x.negative(), r.mantissa(), e, false, c, f);
    }

    @Override
    public T reduce(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = reduce(in(x), resolve(ctx), f);
        return deliver(Operation.REDUCE, ctx, f, r);
    }

    Operand reduce(Operand x, PrecisionContext c, EnumSet<Flag> f) {
        Operand r = roundToPrecision(x, c, f);
        if (!r.isFinite()) {
            return r;
        } else if (r.isZero()) {
            return Operand.zero(r.negative(), BigInteger.ZERO);
        }
        BigInteger limit = c.hasExponentRange() ? rounder.eTop(c) : null;
        BigInteger[] me = radix.stripZeros(r.mantissa(), r.exponent(), limit);
        return Operand.finite(r.negative(), me[0], me[1]);
    }

    // Navigation ----------------------------------------------------

    @Override
    public T nextMinus(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = next(in(x), false, resolve(ctx), f);
        return deliver(Operation.NEXT_MINUS, ctx, f, r);
    }

    @Override
    public T nextPlus(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = next(in(x), true, resolve(ctx), f);
        return deliver(Operation.NEXT_PLUS, ctx, f, r);
    }

    /**
     * The representable number adjacent to {@code x}, found by adding a
     * quantity smaller than any unit of the context and rounding
     * towards it. Only {@code INVALID} is reported.
     */
    Operand next(Operand x, boolean up, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        if (n != null) {
            return n;
        } else if (!c.hasMaxPrecision() || !c.hasExponentRange()) {
            return invalid(f);
        } else if (x.isInfinite()) {
            // Only the infinity pointing away from the direction moves
            return x.negative() == up ? rounder.largest(up, c) : x;
        }
        BigInteger t = x.exponent().min(rounder.eTiny(c)).subtract(TWO);
        Operand tiny = Operand.finite(!up, BigInteger.ONE, t);
        PrecisionContext directed =
                c.withRounding(up ? Rounding.CEILING : Rounding.FLOOR);
        return add(x, tiny, directed, Signals.none());
    }

    @Override
    public T nextToward(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = nextToward(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.NEXT_TOWARD, ctx, f, r);
    }

    Operand nextToward(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) {
            return n;
        } else if (!c.hasMaxPrecision() || !c.hasExponentRange()) {
            return invalid(f);
        }
        int cmp = Ordering.compareValues(x, y, radix);
        if (cmp == 0) { return x.withSign(y.negative()); }
        Operand r = next(x, cmp < 0, c, f);
        if (r.isInfinite()) {
            if (!x.isInfinite()) {
                f.add(Flag.OVERFLOW);
                f.add(Flag.INEXACT);
                f.add(Flag.ROUNDED);
            }
        } else if (r.isZero()
                || r.adjusted(radix).compareTo(c.getEMin()) < 0) {
            f.add(Flag.UNDERFLOW);
            f.add(Flag.SUBNORMAL);
            f.add(Flag.INEXACT);
            f.add(Flag.ROUNDED);
            if (r.isZero()) { f.add(Flag.CLAMPED); }
        }
        return r;
    }

    // Elementary functions ------------------------------------------

    /**
     * An approximation (<i>n</i> ± <i>err</i>)·<i>R</i><sup><i>e</i></sup>
     * to a real result, where <i>err</i> bounds the error.
     *
     * @param n signed approximate mantissa
     * @param e exponent
     * @param err error bound in units of <i>n</i>
     */
    record Approximation(BigInteger n, BigInteger e, long err) {}

    /**
     * Round a real result correctly, given a way to approximate it at
     * any working precision. The precision is doubled until both ends
     * of the error interval round to the same number with the same
     * conditions.
     *
     * @param op for logging
     * @param approx approximation at a given number of digits
     * @param c context (with a precision)
     * @param f to which raised conditions are added
     * @return the correctly rounded result
     */
    private Operand correctlyRounded(Operation op,
            IntFunction<Approximation> approx, PrecisionContext c,
            EnumSet<Flag> f) {
        int w = (int)precisionDigits(c) + ZIV_GUARD;
        for (int i = 0;; i++) {
            Approximation a = approx.apply(w);
            boolean neg = a.n.signum() < 0;
            BigInteger n = a.n.abs();
            BigInteger lo = n.subtract(BigInteger.valueOf(a.err + 1));
            BigInteger hi = n.add(BigInteger.valueOf(a.err));
            if (lo.signum() > 0) {
                EnumSet<Flag> fl = Signals.none(), fh = Signals.none();
                Operand rl = rounder.finish(neg, lo, a.e, true, c, fl);
                Operand rh = rounder.finish(neg, hi, a.e, true, c, fh);
                if (rl.equals(rh) && fl.equals(fh)) {
                    f.addAll(fl);
                    return rl;
                }
            }
            if (i >= ZIV_LIMIT) {
                logger.atWarn()
                        .setMessage("{} undecided at {} digits: rounding "
                                + "the approximation")
                        .addArgument(op.symbol).addArgument(w).log();
                return rounder.finish(neg, n, a.e, true, c, f);
            }
            logger.atTrace().setMessage("{} widened from {} digits")
                    .addArgument(op.symbol).addArgument(w).log();
            w *= 2;
        }
    }

    /**
     * A finite operand as a fixed-point number, truncated.
     *
     * @param x finite operand
     * @param w scale
     * @return signed fixed-point value
     */
    private BigInteger fixed(Operand x, int w) {
        BigInteger k = x.exponent().add(BigInteger.valueOf(w));
        BigInteger m = x.mantissa();
        if (k.signum() < 0 && k.negate()
                .compareTo(BigInteger.valueOf(radix.digits(m))) > 0) {
            return BigInteger.ZERO;
        }
        BigInteger v = elementary.shift(m, k.longValueExact());
        return x.negative() ? v.negate() : v;
    }

    @Override
    public T pi(PrecisionContext ctx) {
        Objects.requireNonNull(ctx, "pi requires a precision context");
        EnumSet<Flag> f = Signals.none();
        Operand r;
        if (!ctx.hasMaxPrecision()) {
            r = invalid(f);
        } else {
            r = correctlyRounded(Operation.PI,
                    w -> new Approximation(elementary.pi(w),
                            BigInteger.valueOf(-w), 2),
                    ctx, f);
        }
        return deliver(Operation.PI, ctx, f, r);
    }

    @Override
    public T exp(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = exp(in(x), resolve(ctx), f);
        return deliver(Operation.EXP, ctx, f, r);
    }

    Operand exp(Operand x, PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        if (n != null) {
            return n;
        } else if (x.isInfinite()) {
            return x.negative() ? Operand.zero(false, BigInteger.ZERO) : x;
        } else if (x.isZero()) {
            return rounder.finish(false, BigInteger.ONE, BigInteger.ZERO,
                    false, c, f);
        } else if (!c.hasMaxPrecision()) {
            return invalid(f);
        }

        BigInteger adj = x.adjusted(radix);
        long p = precisionDigits(c);
        if (adj.compareTo(BigInteger.valueOf(-(p + 3))) < 0) {
            // exp(x) lies strictly between 1 and 1 + x: sticky decides
            if (!x.negative()) {
                return rounder.finish(false, radix.pow(p + 1),
                        BigInteger.valueOf(-(p + 1)), true, c, f);
            }
            return rounder.finish(false,
                    radix.pow(p + 2).subtract(BigInteger.ONE),
                    BigInteger.valueOf(-(p + 2)), true, c, f);
        }
        Operand outside = expOutOfRange(x.negative(), adj, c, f);
        if (outside != null) { return outside; }

        return correctlyRounded(Operation.EXP, w -> {
            Elementary.Scaled s = elementary.exp(fixed(x, w + 2), w + 2);
            return new Approximation(s.mantissa(),
                    s.shift().subtract(BigInteger.valueOf(w + 2)), 16);
        }, c, f);
    }

    /**
     * The result of an exponential whose argument is so large that the
     * result certainly overflows or underflows, or {@code null} if it
     * may not.
     *
     * @param negative sign of the argument
     * @param adj adjusted exponent of the argument
     * @param c context
     * @param f to which raised conditions are added
     * @return the result or {@code null}. With no exponent range, a
     *     result beyond any practical exponent is NaN with
     *     {@link Flag#INVALID}.
     */
    private Operand expOutOfRange(boolean negative, BigInteger adj,
            PrecisionContext c, EnumSet<Flag> f) {
        if (!c.hasExponentRange()) {
            if (adj.compareTo(BigInteger.valueOf(EXP_ARGUMENT_DIGITS)) > 0) {
                logger.atDebug()
                        .setMessage("exponent of exp too large at {}")
                        .addArgument(adj).log();
                return invalid(f);
            }
            return null;
        }
        BigInteger bound = c.getEMax().abs().max(rounder.eTiny(c).abs());
        long digits = radix.digits(bound) + 1;
        if (adj.compareTo(BigInteger.valueOf(digits)) <= 0) { return null; }
        if (!negative) {
            return rounder.finish(false, BigInteger.ONE,
                    c.getEMax().add(BigInteger.ONE), false, c, f);
        }
        return rounder.finish(false, BigInteger.ONE,
                rounder.eTiny(c).subtract(TWO), true, c, f);
    }

    @Override
    public T ln(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = log(in(x), false, resolve(ctx), f);
        return deliver(Operation.LN, ctx, f, r);
    }

    @Override
    public T log10(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = log(in(x), true, resolve(ctx), f);
        return deliver(Operation.LOG10, ctx, f, r);
    }

    /**
     * Natural or base 10 logarithm.
     *
     * @param x operand
     * @param ten whether the base is 10 (rather than <i>e</i>)
     * @param c context
     * @param f to which raised conditions are added
     * @return rounded logarithm
     */
    Operand log(Operand x, boolean ten, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        if (n != null) {
            return n;
        } else if (x.isZero()) {
            return Operand.infinity(true);
        } else if (x.negative()) {
            return invalid(f);
        } else if (x.isInfinite()) {
            return x;
        } else if (isOne(x)) {
            return rounder.finish(false, BigInteger.ZERO, BigInteger.ZERO,
                    false, c, f);
        }
        if (ten) {
            BigInteger k = powerOfTen(x);
            if (k != null) {
                return rounder.finish(k.signum() < 0, k.abs(),
                        BigInteger.ZERO, false, c, f);
            }
        }
        if (!c.hasMaxPrecision()) { return invalid(f); }

        if (!ten) {
            return correctlyRounded(Operation.LN,
                    w -> new Approximation(
                            elementary.ln(x.mantissa(), x.exponent(), w),
                            BigInteger.valueOf(-w), 4),
                    c, f);
        }
        int extra = (int)radix.digits(x.adjusted(radix).abs()) + 3;
        return correctlyRounded(Operation.LOG10, w -> {
            int wx = w + extra;
            BigInteger lx = elementary.ln(x.mantissa(), x.exponent(), wx);
            BigInteger lt = elementary.ln(BigInteger.TEN, BigInteger.ZERO,
                    wx);
            BigInteger q = lx.multiply(radix.pow(wx)).divide(lt);
            return new Approximation(elementary.shift(q, -extra),
                    BigInteger.valueOf(-w), 3);
        }, c, f);
    }

    /**
     * If a positive finite operand is an exact power of ten, the power.
     *
     * @param x positive finite operand
     * @return {@code k} such that {@code x == 10**k}, or {@code null}
     */
    private BigInteger powerOfTen(Operand x) {
        BigInteger[] me = radix.stripZeros(x.mantissa(), x.exponent(), null);
        BigInteger e = me[1];
        if (e.abs().compareTo(BigInteger.valueOf(100_000)) > 0) {
            return null;
        }
        BigInteger num = me[0], den = BigInteger.ONE;
        if (e.signum() >= 0) {
            num = num.multiply(radix.pow(e));
        } else {
            den = radix.pow(e.negate());
            BigInteger g = num.gcd(den);
            num = num.divide(g);
            den = den.divide(g);
        }
        if (den.equals(BigInteger.ONE)) {
            long k = log10Exact(num);
            return k < 0 ? null : BigInteger.valueOf(k);
        } else if (num.equals(BigInteger.ONE)) {
            long k = log10Exact(den);
            return k < 0 ? null : BigInteger.valueOf(-k);
        }
        return null;
    }

    /** {@code k} if {@code n == 10**k}, otherwise -1. */
    private static long log10Exact(BigInteger n) {
        long k = 0;
        BigInteger[] qr = n.divideAndRemainder(BigInteger.TEN);
        while (qr[1].signum() == 0 && n.signum() != 0) {
            n = qr[0];
            k += 1;
            qr = n.divideAndRemainder(BigInteger.TEN);
        }
        return n.equals(BigInteger.ONE) ? k : -1;
    }

    @Override
    public T squareRoot(T x, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = squareRoot(in(x), resolve(ctx), f);
        return deliver(Operation.SQUARE_ROOT, ctx, f, r);
    }

    Operand squareRoot(Operand x, PrecisionContext c, EnumSet<Flag> f) {
        Operand n = nanResult(f, x);
        if (n != null) { return n; }
        if (x.isInfinite()) { return x.negative() ? invalid(f) : x; }
        // floor(e/2)
        BigInteger ideal = x.exponent().shiftRight(1);
        if (x.isZero()) {
            return rounder.finish(x.negative(), BigInteger.ZERO, ideal,
                    false, c, f);
        } else if (x.negative()) {
            return invalid(f);
        }

        BigInteger m = x.mantissa(), e = x.exponent();
        if (e.testBit(0)) {
            m = m.multiply(radix.big);
            e = e.subtract(BigInteger.ONE);
        }
        // Now e is even and sqrt(x) = sqrt(m) * R**(e/2)
        long t = 0;
        if (c.hasMaxPrecision()) {
            long want = 2 * (precisionDigits(c) + 1) - radix.digits(m);
            t = Math.max(0L, (want + 1) / 2);
            m = m.multiply(radix.pow(2 * t));
        }
        BigInteger[] sr = m.sqrtAndRemainder();
        BigInteger exp = e.shiftRight(1).subtract(BigInteger.valueOf(t));
        if (sr[1].signum() != 0) {
            if (!c.hasMaxPrecision()) { return invalid(f); }
            return rounder.finish(false, sr[0], exp, true, c, f);
        }
        BigInteger[] se = radix.stripZeros(sr[0], exp, ideal);
        return rounder.finish(false, se[0], se[1], false, c, f);
    }

    @Override
    public T power(T x, T y, PrecisionContext ctx) {
        EnumSet<Flag> f = Signals.none();
        Operand r = power(in(x), in(y), resolve(ctx), f);
        return deliver(Operation.POWER, ctx, f, r);
    }

    /**
     * Largest estimated number of digits in an exact power before the
     * power is approximated instead.
     */
    private static long exactPowerDigits(PrecisionContext c) {
        return c.hasMaxPrecision() ? Math.max(1000L, 8L * c.getPrecision())
                : 1_000_000L;
    }

    Operand power(Operand x, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        Operand n = nanResult(f, x, y);
        if (n != null) { return n; }

        if (y.isZero()) {
            if (x.isZero()) { return invalid(f); }
            return rounder.finish(false, BigInteger.ONE, BigInteger.ZERO,
                    false, c, f);
        }

        boolean yInteger = y.isInteger(radix);
        boolean yOdd = yInteger && isOdd(y);
        boolean yNeg = y.negative();

        if (x.isInfinite()) {
            boolean neg = x.negative() && yOdd;
            if (yNeg) { return Operand.zero(neg, BigInteger.ZERO); }
            return Operand.infinity(neg);
        } else if (y.isInfinite()) {
            if (x.negative() && !x.isZero()) { return invalid(f); }
            int cmp = x.isZero() ? -1
                    : Ordering.compareMagnitude(x, Operand.valueOf(1),
                            radix);
            if (cmp == 0) {
                // 1 ** inf is inexact, at full precision
                long p = c.hasMaxPrecision() ? precisionDigits(c) : 1;
                f.add(Flag.INEXACT);
                f.add(Flag.ROUNDED);
                return Operand.finite(false, radix.pow(p - 1),
                        BigInteger.valueOf(1 - p));
            }
            return (cmp > 0) != yNeg ? Operand.infinity(false)
                    : Operand.zero(false, BigInteger.ZERO);
        } else if (x.isZero()) {
            boolean neg = x.negative() && yOdd;
            if (yNeg) { return Operand.infinity(neg); }
            return Operand.zero(neg, BigInteger.ZERO);
        } else if (x.negative() && !yInteger) {
            return invalid(f);
        }

        boolean neg = x.negative() && yOdd;
        Operand ax = x.withSign(false);
        if (isOne(ax) && !yInteger) {
            return rounder.finish(false, BigInteger.ONE, BigInteger.ZERO,
                    false, c, f);
        }

        if (yInteger) {
            BigInteger[] me = radix.stripZeros(y.mantissa(), y.exponent(),
                    null);
            long limit = exactPowerDigits(c);
            if (me[1].compareTo(BigInteger.valueOf(20)) <= 0) {
                BigInteger k = me[0].multiply(radix.pow(me[1]));
                long d = radix.digits(ax.mantissa());
                if (k.bitLength() < 31 && d * k.longValue() <= limit) {
                    return integerPower(neg, ax, k.intValue(), yNeg, c, f);
                }
            }
            if (isOne(ax)) {
                return rounder.finish(neg, BigInteger.ONE, BigInteger.ZERO,
                        false, c, f);
            }
        } else {
            Operand r = rationalPower(ax, y, c, f);
            if (r != null) { return r; }
        }
        if (!c.hasMaxPrecision()) { return invalid(f); }
        return approximatePower(neg, ax, y, c, f);
    }

    /** Whether an integer-valued finite operand is odd. */
    private boolean isOdd(Operand y) {
        BigInteger[] me = radix.stripZeros(y.mantissa(), y.exponent(), null);
        if (me[1].signum() > 0) {
            // m * R**e with e > 0 is odd only if both factors are
            return radix.radix % 2 == 1 && me[0].testBit(0);
        }
        return me[0].testBit(0);
    }

    /** |x| ** k exactly, then divided into one if negative, rounded once. */
    private Operand integerPower(boolean neg, Operand ax, int k,
            boolean reciprocal, PrecisionContext c, EnumSet<Flag> f) {
        BigInteger m = ax.mantissa().pow(k);
        BigInteger e = ax.exponent().multiply(BigInteger.valueOf(k));
        if (!reciprocal) { return rounder.finish(neg, m, e, false, c, f); }
        return divide(Operand.finite(neg, BigInteger.ONE, BigInteger.ZERO),
                Operand.finite(false, m, e), c, f);
    }

    /**
     * x ** (a/b) for positive x and non-integer y = a/b in lowest
     * terms, when x has an exact b-th root, or {@code null} if it does
     * not (or that is too costly to discover).
     */
    private Operand rationalPower(Operand ax, Operand y, PrecisionContext c,
            EnumSet<Flag> f) {
        BigInteger[] me = radix.stripZeros(y.mantissa(), y.exponent(), null);
        if (me[1].compareTo(BigInteger.valueOf(-20)) < 0) { return null; }
        BigInteger a = me[0], b = radix.pow(me[1].negate());
        BigInteger g = a.gcd(b);
        a = a.divide(g);
        b = b.divide(g);

        BigInteger num = ax.mantissa(), den = BigInteger.ONE;
        BigInteger ex = ax.exponent();
        if (ex.abs().compareTo(BigInteger.valueOf(100_000)) > 0) {
            return null;
        } else if (ex.signum() >= 0) {
            num = num.multiply(radix.pow(ex));
        } else {
            den = radix.pow(ex.negate());
            BigInteger h = num.gcd(den);
            num = num.divide(h);
            den = den.divide(h);
        }
        int bits = Math.max(num.bitLength(), den.bitLength());
        if (b.bitLength() >= 31 || b.intValue() > bits) { return null; }
        int bi = b.intValue();
        BigInteger r1 = Elementary.root(num, bi);
        BigInteger r2 = Elementary.root(den, bi);
        if (!r1.pow(bi).equals(num) || !r2.pow(bi).equals(den)) {
            return null;
        }
        long digits = radix.digits(r1) + radix.digits(r2);
        if (a.bitLength() >= 31
                || digits * a.longValue() > exactPowerDigits(c)) {
            return null;
        }
        int ai = a.intValue();
        BigInteger n1 = r1.pow(ai), n2 = r2.pow(ai);
        if (y.negative()) {
            BigInteger t = n1;
            n1 = n2;
            n2 = t;
        }
        return divide(Operand.finite(false, n1, BigInteger.ZERO),
                Operand.finite(false, n2, BigInteger.ZERO), c, f);
    }

    /** exp(y ln |x|), correctly rounded, with sign applied. */
    private Operand approximatePower(boolean neg, Operand ax, Operand y,
            PrecisionContext c, EnumSet<Flag> f) {
        // Settle overflow and underflow on a rough value of y ln x
        int extra = (int)Math.max(0L,
                y.adjusted(radix).longValueExact() + 1) + 4;
        BigInteger rough = yTimesLn(ax, y, 4 + extra, extra);
        Operand t = Operand.finite(rough.signum() < 0, rough.abs(),
                BigInteger.valueOf(-4));
        if (!t.isZero()) {
            Operand outside = expOutOfRange(t.negative(),
                    t.adjusted(radix).add(BigInteger.ONE), c, f);
            if (outside != null) {
                return outside.isNaN() ? outside : outside.withSign(neg);
            }
        }
        Operand r = correctlyRounded(Operation.POWER, w -> {
            int wt = w + 2;
            BigInteger tw = yTimesLn(ax, y, wt + extra, extra);
            Elementary.Scaled s = elementary.exp(tw, wt);
            return new Approximation(s.mantissa(),
                    s.shift().subtract(BigInteger.valueOf(wt)), 16);
        }, c, f);
        return r.withSign(neg);
    }

    /**
     * y ln |x| as a fixed-point number, computed at scale {@code wx}
     * and returned at scale {@code wx - extra}.
     */
    private BigInteger yTimesLn(Operand ax, Operand y, int wx, int extra) {
        BigInteger l = elementary.ln(ax.mantissa(), ax.exponent(), wx);
        BigInteger t = l.multiply(y.mantissa());
        long ey = y.exponent().longValueExact();
        t = elementary.shift(t, ey - extra);
        return y.negative() ? t.negate() : t;
    }
}
