// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;

/**
 * Fixed-point approximations to the elementary functions, in one radix.
 * A fixed-point number at scale {@code w} is an integer {@code N}
 * standing for <i>N</i>·<i>R</i><sup>−<i>w</i></sup>. Each method
 * states a bound on its error in units of the last place; the full
 * engine widens {@code w} until the bound is small enough for the
 * rounding to be decided.
 * <p>
 * Instances cache the most precise values of ln <i>R</i> and π computed
 * so far and are safe for concurrent use.
 */
final class Elementary {

    /** Square roots taken to bring an argument close to 1 for ln. */
    private static final int ROOTS = 12;

    private final Radix radix;

    /** Extra digits carried internally: covers 2**ROOTS and series error. */
    private final int guard;

    /** A fixed-point value and its scale. */
    private record Cached(int scale, BigInteger value) {}

    private volatile Cached lnRadix;
    private volatile Cached pi;

    Elementary(Radix radix) {
        this.radix = radix;
        this.guard = (int)radix.digitsForBits(ROOTS + 10) + 2;
    }

    /**
     * An approximation <i>M</i>·<i>R</i><sup><i>shift</i>−<i>scale</i></sup>
     * where <i>M</i> lies roughly in [<i>R</i><sup>scale−1</sup>,
     * <i>R</i><sup>scale+1</sup>].
     *
     * @param mantissa <i>M</i>
     * @param scale fractional digits in <i>M</i>
     * @param shift power of the radix applied
     */
    record Scaled(BigInteger mantissa, int scale, BigInteger shift) {}

    /**
     * Multiply by a power of the radix, truncating if it is negative.
     *
     * @param n integer
     * @param k power (either sign)
     * @return <i>n</i>·<i>R</i><sup><i>k</i></sup>, truncated
     */
    BigInteger shift(BigInteger n, long k) {
        if (k >= 0) {
            return n.multiply(radix.pow(k));
        } else if (-k > radix.digits(n.abs())) {
            return BigInteger.ZERO;
        } else {
            return n.divide(radix.pow(-k));
        }
    }

    /**
     * ln <i>R</i>. Error at most 2 units.
     *
     * @param w scale of the result
     * @return fixed-point ln <i>R</i>
     */
    BigInteger lnRadix(int w) {
        Cached c = lnRadix;
        if (c == null || c.scale < w) {
            int wg = w + guard;
            BigInteger s = radix.pow(wg);
            c = new Cached(w, lnNearOne(s.multiply(radix.big), wg));
            lnRadix = c;
        }
        return shift(c.value, w - c.scale);
    }

    /**
     * π by Machin's formula. Error at most 2 units.
     *
     * @param w scale of the result
     * @return fixed-point π
     */
    BigInteger pi(int w) {
        Cached c = pi;
        if (c == null || c.scale < w) {
            int wg = w + guard;
            BigInteger s = radix.pow(wg);
            BigInteger v = arctanInverse(5, s).shiftLeft(4)
                    .subtract(arctanInverse(239, s).shiftLeft(2));
            c = new Cached(w, shift(v, -guard));
            pi = c;
        }
        return shift(c.value, w - c.scale);
    }

    /** arctan(1/x) at the given scale. */
    private static BigInteger arctanInverse(int x, BigInteger s) {
        BigInteger bx = BigInteger.valueOf(x);
        BigInteger x2 = BigInteger.valueOf((long)x * x);
        BigInteger term = s.divide(bx);
        BigInteger sum = term;
        boolean subtract = true;
        for (long k = 3; term.signum() != 0; k += 2) {
            term = term.divide(x2);
            BigInteger t = term.divide(BigInteger.valueOf(k));
            sum = subtract ? sum.subtract(t) : sum.add(t);
            subtract = !subtract;
        }
        return sum;
    }

    /**
     * Natural logarithm of a value in [1, <i>R</i>] given at scale
     * {@code wg} (which includes guard digits), by repeated square
     * roots then the series for atanh. The result is at scale
     * {@code wg - guard}.
     */
    private BigInteger lnNearOne(BigInteger f, int wg) {
        BigInteger s = radix.pow(wg);
        for (int i = 0; i < ROOTS; i++) { f = f.multiply(s).sqrt(); }
        BigInteger z = f.subtract(s).multiply(s).divide(f.add(s));
        BigInteger zz = z.multiply(z).divide(s);
        BigInteger term = z, sum = z;
        for (long k = 3; term.signum() != 0; k += 2) {
            term = term.multiply(zz).divide(s);
            sum = sum.add(term.divide(BigInteger.valueOf(k)));
        }
        return shift(sum.shiftLeft(ROOTS + 1), -guard);
    }

    /**
     * Natural logarithm of <i>m</i>·<i>R</i><sup><i>e</i></sup>. Error at
     * most 4 units.
     *
     * @param m positive mantissa
     * @param e exponent
     * @param w scale of the result
     * @return fixed-point logarithm
     */
    BigInteger ln(BigInteger m, BigInteger e, int w) {
        long d = radix.digits(m);
        // m * R**e = f * R**a where 1 <= f < R
        BigInteger a = e.add(BigInteger.valueOf(d - 1));
        int wg = w + guard;
        BigInteger lf = lnNearOne(shift(m, wg - (d - 1)), wg);
        if (a.signum() == 0) { return lf; }
        int extra = (int)radix.digits(a.abs()) + 1;
        BigInteger lr = lnRadix(w + extra);
        return lf.add(shift(lr.multiply(a), -extra));
    }

    /**
     * Exponential of a fixed-point number, as a mantissa and a power of
     * the radix, by reducing the argument modulo ln <i>R</i>, halving
     * it {@code ROOTS} times, summing the Taylor series and squaring
     * back. Relative error at most 4 units of the mantissa.
     *
     * @param t the argument at scale {@code w}
     * @param w scale of the argument and of the result mantissa
     * @return exp(t) approximately
     */
    Scaled exp(BigInteger t, int w) {
        int wg = w + guard;
        BigInteger s = radix.pow(wg);
        BigInteger tg = shift(t, guard);

        // n = round(t / ln R), r = t - n ln R
        BigInteger n = roundedQuotient(tg, lnRadix(wg));
        int extra = (int)radix.digits(n.abs()) + 1;
        BigInteger r = tg.subtract(shift(lnRadix(wg + extra).multiply(n),
                -extra));

        BigInteger h = r.divide(BigInteger.ONE.shiftLeft(ROOTS));
        BigInteger sum = s, term = s;
        for (long i = 1; term.signum() != 0; i++) {
            term = term.multiply(h).divide(s).divide(BigInteger.valueOf(i));
            sum = sum.add(term);
        }
        for (int i = 0; i < ROOTS; i++) {
            sum = sum.multiply(sum).divide(s);
        }
        return new Scaled(shift(sum, -guard), w, n);
    }

    /** Quotient rounded to the nearest integer (ties away from zero). */
    static BigInteger roundedQuotient(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].abs().shiftLeft(1).compareTo(b.abs()) >= 0) {
            return qr[0].add(
                    BigInteger.valueOf(a.signum() * b.signum()));
        }
        return qr[0];
    }

    /**
     * Integer {@code b}th root, rounded down, by Newton's method from
     * above.
     *
     * @param a non-negative integer
     * @param b degree of root (positive)
     * @return the greatest integer whose {@code b}th power is at most
     *     {@code a}
     */
    static BigInteger root(BigInteger a, int b) {
        if (a.signum() == 0 || b == 1) { return a; }
        BigInteger bb = BigInteger.valueOf(b);
        BigInteger b1 = BigInteger.valueOf(b - 1);
        int bits = (a.bitLength() + b - 1) / b;
        BigInteger x = BigInteger.ONE.shiftLeft(bits);
        while (true) {
            BigInteger y = b1.multiply(x).add(a.divide(x.pow(b - 1)))
                    .divide(bb);
            if (y.compareTo(x) >= 0) { return x; }
            x = y;
        }
    }
}
