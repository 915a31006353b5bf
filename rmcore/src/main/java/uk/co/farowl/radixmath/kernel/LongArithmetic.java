// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.util.Arrays;

/**
 * Overflow-aware arithmetic on {@code long} for the simplified engine.
 * The tests are cheap and may be conservative: a {@code false} answer
 * to "fits" sends the caller to the full engine, which is always
 * correct, so it is only necessary never to answer {@code true} wrongly.
 */
final class LongArithmetic {

    private static final long BIT63 = 0x8000_0000_0000_0000L;

    /** Tables of powers {@code radix**n} that fit a long, by radix. */
    private static final long[][] POWERS = new long[37][];

    static {
        for (int r = 2; r < POWERS.length; r++) {
            long[] table = new long[64];
            int n = 0;
            long p = 1;
            table[n++] = p;
            while (p <= Long.MAX_VALUE / r) {
                p *= r;
                table[n++] = p;
            }
            POWERS[r] = Arrays.copyOf(table, n);
        }
    }

    private LongArithmetic() {}  // no instances

    /**
     * {@code radix**n} if it fits a long.
     *
     * @param radix from 2 to 36
     * @param n non-negative power
     * @return the power, or -1 if it would overflow (or the radix is
     *     not tabulated)
     */
    static long pow(int radix, long n) {
        if (radix >= POWERS.length) { return -1L; }
        long[] table = POWERS[radix];
        return n < table.length ? table[(int)n] : -1L;
    }

    /**
     * Number of digits in a non-negative long. Zero has one digit.
     *
     * @param m non-negative
     * @param radix from 2 to 36
     * @return digit count
     */
    static int digits(long m, int radix) {
        long[] table = POWERS[radix];
        int d = 1;
        while (d < table.length && m >= table[d]) { d++; }
        return d;
    }

    /**
     * Whether {@code v + w} is exactly representable. Overflow is
     * detected from the sign bits: operands of opposite sign cannot
     * overflow, and otherwise the sum must have their sign.
     *
     * @param v left operand
     * @param w right operand
     * @return whether the sum fits
     */
    static boolean sumFits(long v, long w) {
        long r = v + w;
        return ((v ^ w) & BIT63) != 0L || ((v ^ r) & BIT63) == 0L;
    }

    /**
     * Whether {@code v * w} certainly fits a long, judged by the
     * leading zeros of the magnitudes. {@code Long.MIN_VALUE} is
     * excluded as an operand.
     *
     * @param v left operand
     * @param w right operand
     * @return whether the product fits
     */
    static boolean productFits(long v, long w) {
        if (v == 0L || w == 0L) {
            return true;
        } else if (v == Long.MIN_VALUE || w == Long.MIN_VALUE) {
            return false;
        }
        // |v| < 2**(64-zv)
        int zv = Long.numberOfLeadingZeros(Math.abs(v));
        int zw = Long.numberOfLeadingZeros(Math.abs(w));
        // |v||w| < 2**(128-(zv+zw)) <= 2**63
        return zv + zw >= 65;
    }
}
