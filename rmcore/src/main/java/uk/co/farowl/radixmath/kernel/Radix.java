// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Digit arithmetic in one radix: powers, digit counts and the prime
 * factors that decide whether a quotient terminates.
 */
public final class Radix {

    /** Powers cached: {@code R**0} to {@code R**(CACHED-1)}. */
    private static final int CACHED = 64;

    /** The radix as an {@code int}. */
    final int radix;
    /** The radix as a {@code BigInteger}. */
    final BigInteger big;
    /** {@code log(2) / log(radix)}, for estimating digit counts. */
    private final double digitsPerBit;
    private final BigInteger[] powers = new BigInteger[CACHED];
    /** Distinct primes dividing the radix. */
    private final List<Integer> primes;
    /** Multiplicity in the radix of each of {@link #primes}. */
    private final List<Integer> multiplicity;

    /**
     * @param radix at least 2
     * @throws IllegalArgumentException if the radix is less than 2
     */
    public Radix(int radix) {
        if (radix < 2) {
            throw new IllegalArgumentException("radix must be at least 2");
        }
        this.radix = radix;
        this.big = BigInteger.valueOf(radix);
        this.digitsPerBit = Math.log(2) / Math.log(radix);
        BigInteger p = BigInteger.ONE;
        for (int i = 0; i < CACHED; i++) {
            powers[i] = p;
            p = p.multiply(big);
        }
        List<Integer> ps = new ArrayList<>(), ms = new ArrayList<>();
        int r = radix;
        for (int f = 2; f <= r; f++) {
            int m = 0;
            while (r % f == 0) {
                r /= f;
                m += 1;
            }
            if (m > 0) {
                ps.add(f);
                ms.add(m);
            }
        }
        this.primes = Collections.unmodifiableList(ps);
        this.multiplicity = Collections.unmodifiableList(ms);
    }

    /** @return the radix */
    public int get() { return radix; }

    /**
     * @param n non-negative power
     * @return radix to the power {@code n}
     */
    BigInteger pow(long n) {
        if (n < CACHED) { return powers[(int)n]; }
        return big.pow(Math.toIntExact(n));
    }

    /**
     * @param n non-negative power
     * @return radix to the power {@code n}
     * @throws ArithmeticException if {@code n} is beyond all reason
     */
    BigInteger pow(BigInteger n) { return pow(n.longValueExact()); }

    /**
     * Number of digits in the radix representation of a non-negative
     * integer. Zero is deemed to have one digit.
     *
     * @param m non-negative integer
     * @return digit count
     */
    long digits(BigInteger m) {
        int bits = m.bitLength();
        if (bits == 0) {
            return 1;
        } else if (radix == 2) {
            return bits;
        }
        // m >= 2**(bits-1) so this is a lower bound or one above it
        long d = (long)((bits - 1) * digitsPerBit) + 1;
        while (d > 1 && m.compareTo(pow(d - 1)) < 0) { d -= 1; }
        while (m.compareTo(pow(d)) >= 0) { d += 1; }
        return d;
    }

    /**
     * Number of radix digits sufficient to represent any integer of the
     * given number of bits.
     *
     * @param bits a bit length
     * @return an upper bound on the digits
     */
    long digitsForBits(long bits) {
        return (long)Math.ceil(bits * digitsPerBit) + 1;
    }

    /**
     * Digit count for a working precision equivalent to the given
     * number of bits or digits.
     *
     * @param precision the precision
     * @param inBits whether it counts bits
     * @return the precision in digits (rounded up)
     */
    long digitsFor(int precision, boolean inBits) {
        if (!inBits || radix == 2) { return precision; }
        return (long)Math.ceil(precision * digitsPerBit);
    }

    /**
     * The last digit of a non-negative integer.
     *
     * @param m non-negative integer
     * @return {@code m mod radix}
     */
    int lastDigit(BigInteger m) {
        return m.mod(big).intValue();
    }

    /**
     * Find the least {@code k} such that {@code radix**k / den} is an
     * integer, if there is one. A fraction with this denominator (in
     * lowest terms) then has a terminating expansion of {@code k}
     * digits.
     *
     * @param den positive denominator in lowest terms
     * @return {@code k} or -1 if the expansion does not terminate
     */
    long terminatingDigits(BigInteger den) {
        long k = 0;
        for (int i = 0; i < primes.size(); i++) {
            BigInteger p = BigInteger.valueOf(primes.get(i));
            long count = 0;
            BigInteger[] qr = den.divideAndRemainder(p);
            while (qr[1].signum() == 0) {
                den = qr[0];
                count += 1;
                qr = den.divideAndRemainder(p);
            }
            int mult = multiplicity.get(i);
            k = Math.max(k, (count + mult - 1) / mult);
        }
        return den.equals(BigInteger.ONE) ? k : -1;
    }

    /**
     * Remove trailing zero digits from a mantissa, raising its exponent
     * by one for each, but not beyond a limit.
     *
     * @param m mantissa (non-zero)
     * @param e exponent
     * @param limit highest exponent allowed ({@code null} for none)
     * @return the reduced mantissa and exponent
     */
    BigInteger[] stripZeros(BigInteger m, BigInteger e, BigInteger limit) {
        if (m.signum() != 0) {
            BigInteger[] qr = m.divideAndRemainder(big);
            while (qr[1].signum() == 0
                    && (limit == null || e.compareTo(limit) < 0)) {
                m = qr[0];
                e = e.add(BigInteger.ONE);
                qr = m.divideAndRemainder(big);
            }
        }
        return new BigInteger[] {m, e};
    }

    @Override
    public String toString() { return "Radix(" + radix + ")"; }
}
