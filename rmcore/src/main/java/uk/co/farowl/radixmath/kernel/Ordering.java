// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;

/**
 * Numerical comparison of operands, and the rules by which minimum and
 * maximum choose between numerically equal ones. The choice rules are
 * shared by both engines, which must agree on them exactly.
 */
final class Ordering {

    private Ordering() {}  // no instances

    /**
     * Compare the magnitudes of two operands neither of which is a NaN.
     *
     * @param x left operand
     * @param y right operand
     * @param r radix of both
     * @return the sign of {@code |x| - |y|}
     */
    static int compareMagnitude(Operand x, Operand y, Radix r) {
        if (x.isInfinite()) {
            return y.isInfinite() ? 0 : 1;
        } else if (y.isInfinite()) {
            return -1;
        }
        boolean xz = x.isZero(), yz = y.isZero();
        if (xz || yz) { return xz ? (yz ? 0 : -1) : 1; }
        int c = x.adjusted(r).compareTo(y.adjusted(r));
        if (c != 0) { return c; }
        // Same adjusted exponent: the shift is at most the digit count
        BigInteger mx = x.mantissa(), my = y.mantissa();
        int d = x.exponent().compareTo(y.exponent());
        if (d > 0) {
            mx = mx.multiply(r.pow(x.exponent().subtract(y.exponent())));
        } else if (d < 0) {
            my = my.multiply(r.pow(y.exponent().subtract(x.exponent())));
        }
        return mx.compareTo(my);
    }

    /**
     * Compare the values of two operands neither of which is a NaN.
     * Zeros are equal whatever their signs.
     *
     * @param x left operand
     * @param y right operand
     * @param r radix of both
     * @return the sign of {@code x - y}
     */
    static int compareValues(Operand x, Operand y, Radix r) {
        if (x.isZero() && y.isZero()) { return 0; }
        boolean xn = x.negative() && !x.isZero();
        boolean yn = y.negative() && !y.isZero();
        if (xn != yn) {
            // Also covers a zero against a non-zero of either sign
            if (x.isZero()) { return yn ? 1 : -1; }
            if (y.isZero()) { return xn ? -1 : 1; }
            return xn ? -1 : 1;
        }
        int c = compareMagnitude(x, y, r);
        return xn ? -c : c;
    }

    /**
     * Whether the maximum of two numbers is the left one.
     *
     * @param cmp sign of {@code x - y}
     * @param xNeg sign of {@code x}
     * @param yNeg sign of {@code y}
     * @param expCmp sign of {@code x.exponent - y.exponent}
     * @return whether to choose {@code x}
     */
    static boolean maxIsLeft(int cmp, boolean xNeg, boolean yNeg,
            int expCmp) {
        if (cmp != 0) {
            return cmp > 0;
        } else if (xNeg != yNeg) {
            return !xNeg;
        } else {
            // Positive: larger exponent. Negative: smaller exponent.
            return xNeg ? expCmp <= 0 : expCmp >= 0;
        }
    }

    /**
     * Whether the minimum of two numbers is the left one.
     *
     * @param cmp sign of {@code x - y}
     * @param xNeg sign of {@code x}
     * @param yNeg sign of {@code y}
     * @param expCmp sign of {@code x.exponent - y.exponent}
     * @return whether to choose {@code x}
     */
    static boolean minIsLeft(int cmp, boolean xNeg, boolean yNeg,
            int expCmp) {
        if (cmp != 0) {
            return cmp < 0;
        } else if (xNeg != yNeg) {
            return xNeg;
        } else {
            return xNeg ? expCmp >= 0 : expCmp <= 0;
        }
    }
}
