// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

/**
 * Rounding modes. Each mode decides, from a summary of the digits
 * being discarded, whether the retained mantissa is to be incremented
 * in magnitude. Both engines make this decision through
 * {@link #roundsAway(boolean, boolean, int, int, int, boolean)}, so
 * that they cannot disagree about it.
 */
public enum Rounding {

    /** To nearest, ties to the even neighbour. */
    HALF_EVEN {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return half > 0 || (half == 0 && odd);
        }
    },

    /** To nearest, ties away from zero. */
    HALF_UP {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return half >= 0;
        }
    },

    /** To nearest, ties towards zero. */
    HALF_DOWN {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return half > 0;
        }
    },

    /** Away from zero. */
    UP {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return true;
        }
    },

    /** Towards zero (truncation). */
    DOWN {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return false;
        }
    },

    /** Towards positive infinity. */
    CEILING {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return !negative;
        }
    },

    /** Towards negative infinity. */
    FLOOR {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return negative;
        }
    },

    /**
     * Towards zero, unless that would leave a last digit of zero (or,
     * in decimal, five), in which case away from zero. This keeps
     * enough information for a later correct rounding to fewer digits.
     */
    ZERO_FIVE_UP {
        @Override
        boolean away(boolean negative, boolean odd, int lastDigit,
                int radix, int half) {
            return lastDigit == 0 || (radix == 10 && lastDigit == 5);
        }
    };

    /**
     * Mode-specific part of {@link #roundsAway}, consulted only when
     * something non-zero is discarded.
     */
    abstract boolean away(boolean negative, boolean odd, int lastDigit,
            int radix, int half);

    /**
     * Decide whether a truncated mantissa must be incremented (in
     * magnitude) to round it in this mode.
     *
     * @param negative sign of the number being rounded
     * @param odd whether the truncated mantissa is odd
     * @param lastDigit last digit of the truncated mantissa
     * @param radix of the representation
     * @param half sign of (discarded part − half a unit in the last
     *     retained place)
     * @param inexact whether anything non-zero was discarded
     * @return whether to increment the truncated mantissa
     */
    public boolean roundsAway(boolean negative, boolean odd,
            int lastDigit, int radix, int half, boolean inexact) {
        return inexact && away(negative, odd, lastDigit, radix, half);
    }

    /**
     * Whether an overflowing result of the given sign becomes infinite
     * (rather than the largest finite number) in this mode.
     *
     * @param negative sign of the overflowing result
     * @return whether the result is an infinity
     */
    public boolean overflowsToInfinity(boolean negative) {
        switch (this) {
            case DOWN:
            case ZERO_FIVE_UP:
                return false;
            case CEILING:
                return !negative;
            case FLOOR:
                return negative;
            default:
                return true;
        }
    }
}
