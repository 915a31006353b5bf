// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;
import java.util.EnumSet;

import uk.co.farowl.radixmath.Flag;
import uk.co.farowl.radixmath.PrecisionContext;
import uk.co.farowl.radixmath.Rounding;

/**
 * Bring an exact (or exact-plus-sticky) result into the form a context
 * allows: at most the precision in digits, an exponent within range,
 * and the conditions that arise in getting there. Every operation of
 * the full engine that produces a finite result ends by calling
 * {@link #finish(boolean, BigInteger, BigInteger, boolean,
 * PrecisionContext, EnumSet)},
 * and it rounds exactly once.
 * <p>
 * A <i>sticky</i> argument stands for a non-zero quantity smaller than
 * one unit in the last place of the mantissa supplied. An operation that
 * cannot compute its result exactly (a quotient, a logarithm) supplies
 * enough digits that the rounding digit is among them, and a sticky
 * bit to say whether anything non-zero lies beyond.
 */
final class Rounder {

    final Radix radix;

    Rounder(Radix radix) { this.radix = radix; }

    /**
     * A mantissa after discarding low-order digits.
     *
     * @param mantissa the (possibly incremented) retained digits
     * @param inexact whether anything non-zero was discarded
     */
    record Rounded(BigInteger mantissa, boolean inexact) {}

    /**
     * Discard {@code k} digits from a mantissa, rounding it according to
     * the given mode.
     *
     * @param m non-negative mantissa
     * @param k number of digits to discard (non-negative)
     * @param sticky whether something non-zero lies beyond {@code m}
     * @param negative sign of the number
     * @param rounding mode
     * @return rounded mantissa and whether it is inexact
     */
    Rounded round(BigInteger m, BigInteger k, boolean sticky,
            boolean negative, Rounding rounding) {
        BigInteger q;
        int half;
        boolean inexact;
        int kSign = k.signum();
        if (kSign == 0) {
            q = m;
            half = -1;
            inexact = sticky;
        } else if (k.compareTo(BigInteger.valueOf(radix.digits(m))) > 0) {
            // Everything is discarded and it is less than half a unit
            q = BigInteger.ZERO;
            half = -1;
            inexact = sticky || m.signum() != 0;
        } else {
            BigInteger pk = radix.pow(k.longValueExact());
            BigInteger[] qr = m.divideAndRemainder(pk);
            q = qr[0];
            BigInteger r = qr[1];
            half = r.shiftLeft(1).compareTo(pk);
            if (half == 0 && sticky) { half = 1; }
            inexact = sticky || r.signum() != 0;
        }
        if (rounding.roundsAway(negative, q.testBit(0), radix.lastDigit(q),
                radix.radix, half, inexact)) {
            q = q.add(BigInteger.ONE);
        }
        return new Rounded(q, inexact);
    }

    /**
     * Whether a mantissa is within the precision of a context.
     *
     * @param m non-negative mantissa
     * @param c context
     * @return whether it fits
     */
    boolean fits(BigInteger m, PrecisionContext c) {
        int p = c.getPrecision();
        if (p == 0) {
            return true;
        } else if (c.isPrecisionInBits()) {
            return m.bitLength() <= p;
        } else {
            return radix.digits(m) <= p;
        }
    }

    /**
     * The most digits a mantissa may have in the context, or 1 if the
     * precision is unlimited. (When the precision counts bits, this is
     * the digit count of the largest mantissa that fits.)
     */
    long maxDigits(PrecisionContext c) {
        int p = c.getPrecision();
        if (p == 0) {
            return 1;
        } else if (c.isPrecisionInBits()) {
            return radix.digits(largestMantissa(c));
        } else {
            return p;
        }
    }

    /** The largest mantissa that fits the (limited) precision. */
    BigInteger largestMantissa(PrecisionContext c) {
        int p = c.getPrecision();
        BigInteger top = c.isPrecisionInBits() ? BigInteger.ONE.shiftLeft(p)
                : radix.pow(p);
        return top.subtract(BigInteger.ONE);
    }

    /**
     * The least exponent of any number (the exponent of the smallest
     * subnormal), in a context with a limited precision and a range.
     */
    BigInteger eTiny(PrecisionContext c) {
        return c.getEMin().subtract(BigInteger.valueOf(maxDigits(c) - 1));
    }

    /**
     * The greatest exponent of any number in a context with a range.
     * When exponents are clamped this is the exponent of the largest
     * finite number, otherwise it is the maximum adjusted exponent.
     */
    BigInteger eTop(PrecisionContext c) {
        if (c.isClampNormalExponents() && c.hasMaxPrecision()) {
            return c.getEMax()
                    .subtract(BigInteger.valueOf(maxDigits(c) - 1));
        }
        return c.getEMax();
    }

    /**
     * Number of digits that must go from a mantissa to bring it within
     * the precision of the context.
     */
    private long excess(BigInteger m, long digits, PrecisionContext c) {
        int p = c.getPrecision();
        if (!c.isPrecisionInBits()) { return Math.max(0L, digits - p); }
        int bits = m.bitLength();
        if (bits <= p) {
            return 0;
        } else if (radix.radix == 2) {
            return bits - p;
        }
        // Estimate low then step up
        long k = Math.max(0L, radix.digitsForBits(bits - p) - 3);
        while (m.divide(radix.pow(k)).bitLength() > p) { k += 1; }
        return k;
    }

    /**
     * Round a finite operand to the context.
     *
     * @param x finite operand
     * @param c context
     * @param flags to which raised conditions are added
     * @return rounded result
     */
    Operand finish(Operand x, PrecisionContext c, EnumSet<Flag> flags) {
        return finish(x.negative(), x.mantissa(), x.exponent(), false, c,
                flags);
    }

    /**
     * Round an exact value, or an exact value plus a sticky quantity, to
     * the context. This is the single rounding step of an operation.
     *
     * @param neg sign of the result
     * @param m non-negative mantissa
     * @param e exponent
     * @param sticky whether something non-zero lies beyond {@code m}
     * @param c context
     * @param flags to which raised conditions are added
     * @return rounded result (finite or infinite)
     */
    Operand finish(boolean neg, BigInteger m, BigInteger e, boolean sticky,
            PrecisionContext c, EnumSet<Flag> flags) {

        if (m.signum() == 0 && !sticky) { return zero(neg, e, c, flags); }

        boolean range = c.hasExponentRange();
        boolean limited = c.hasMaxPrecision();
        long digits = radix.digits(m);
        // Adjusted exponent before rounding (sticky alone lies below e)
        BigInteger adj = m.signum() == 0 ? e.subtract(BigInteger.ONE)
                : e.add(BigInteger.valueOf(digits - 1));

        // Least exponent the result may have
        BigInteger target = e;
        if (limited) {
            target = e.add(BigInteger.valueOf(excess(m, digits, c)));
            if (range) { target = target.max(eTiny(c)); }
        }

        BigInteger k = target.subtract(e);
        Rounding rounding = c.getRounding();
        Rounded r = round(m, k, sticky, neg, rounding);
        if (limited && !fits(r.mantissa, c)) {
            // Rounding carried out of the top: discard one more
            target = target.add(BigInteger.ONE);
            k = k.add(BigInteger.ONE);
            r = round(m, k, sticky, neg, rounding);
        }
        BigInteger q = r.mantissa;

        if (k.signum() > 0) { flags.add(Flag.ROUNDED); }
        if (r.inexact) {
            flags.add(Flag.INEXACT);
            flags.add(Flag.ROUNDED);
        }

        if (range) {
            if (adj.compareTo(c.getEMin()) < 0) {
                flags.add(Flag.SUBNORMAL);
                if (r.inexact) { flags.add(Flag.UNDERFLOW); }
                if (q.signum() == 0) { flags.add(Flag.CLAMPED); }
            }
            if (q.signum() != 0) {
                BigInteger adjQ = target
                        .add(BigInteger.valueOf(radix.digits(q) - 1));
                if (adjQ.compareTo(c.getEMax()) > 0) {
                    return overflow(neg, c, flags);
                }
                BigInteger top = eTop(c);
                if (target.compareTo(top) > 0) {
                    // Fold the exponent down by padding with zeros
                    q = q.multiply(radix.pow(target.subtract(top)));
                    target = top;
                    flags.add(Flag.CLAMPED);
                }
            }
        }
        return Operand.finite(neg, q, target);
    }

    /**
     * A zero with its exponent brought within range.
     *
     * @param neg sign
     * @param e exponent wanted
     * @param c context
     * @param flags to which raised conditions are added
     * @return zero
     */
    Operand zero(boolean neg, BigInteger e, PrecisionContext c,
            EnumSet<Flag> flags) {
        if (c.hasExponentRange()) {
            BigInteger top = eTop(c);
            if (c.hasMaxPrecision() && e.compareTo(eTiny(c)) < 0) {
                e = eTiny(c);
                flags.add(Flag.CLAMPED);
            } else if (e.compareTo(top) > 0) {
                e = top;
                flags.add(Flag.CLAMPED);
            }
        }
        return Operand.zero(neg, e);
    }

    /**
     * The result of an overflow: infinity or the largest finite number,
     * depending on the rounding mode.
     *
     * @param neg sign
     * @param c context (with a range)
     * @param flags to which raised conditions are added
     * @return overflowed result
     */
    Operand overflow(boolean neg, PrecisionContext c,
            EnumSet<Flag> flags) {
        flags.add(Flag.OVERFLOW);
        flags.add(Flag.INEXACT);
        flags.add(Flag.ROUNDED);
        if (!c.hasMaxPrecision()
                || c.getRounding().overflowsToInfinity(neg)) {
            return Operand.infinity(neg);
        }
        return largest(neg, c);
    }

    /**
     * The finite number of greatest magnitude in a context with a
     * precision and range.
     *
     * @param neg sign
     * @param c context
     * @return largest finite number
     */
    Operand largest(boolean neg, PrecisionContext c) {
        BigInteger m = largestMantissa(c);
        BigInteger e = c.getEMax()
                .subtract(BigInteger.valueOf(radix.digits(m) - 1));
        return Operand.finite(neg, m, e);
    }

    /**
     * The exponent of a zero that stands for a quantity too small to
     * represent: the least exponent if there is one, otherwise zero.
     */
    BigInteger tinyExponent(PrecisionContext c) {
        if (c.hasExponentRange() && c.hasMaxPrecision()) {
            return eTiny(c);
        }
        return BigInteger.ZERO;
    }
}
