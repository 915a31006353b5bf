// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.math.BigInteger;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * The simplified engine must give exactly the result and conditions of
 * the full engine wherever its fast paths apply, and hand over to the
 * full engine where they do not. This is checked over a pseudo-random
 * (but repeatable) sample of operands and contexts in several radices.
 */
@DisplayName("The simplified engine agrees with the full engine")
class DispatchEquivalenceTest extends UnitTestSupport {

    private static final int TRIALS = 3000;

    /** One binary operation under test, by name. */
    private interface Op {
        TestNumber apply(RadixMath<TestNumber> m, TestNumber x, TestNumber y,
                PrecisionContext c);
    }

    private static final String[] NAMES = {"add", "addEx", "multiply",
            "divide", "quantize", "min", "max", "minMagnitude",
            "maxMagnitude", "compare", "plus", "negate", "abs", "round",
            "reduce", "toExponentExact", "toExponentSimple",
            "toExponentNoRounded"};

    private static final Op[] OPS = {
            (m, x, y, c) -> m.add(x, y, c),
            (m, x, y, c) -> m.addEx(x, y, c, true),
            (m, x, y, c) -> m.multiply(x, y, c),
            (m, x, y, c) -> m.divide(x, y, c),
            (m, x, y, c) -> m.quantize(x, y, c),
            (m, x, y, c) -> m.min(x, y, c),
            (m, x, y, c) -> m.max(x, y, c),
            (m, x, y, c) -> m.minMagnitude(x, y, c),
            (m, x, y, c) -> m.maxMagnitude(x, y, c),
            (m, x, y, c) -> m.compareToWithContext(x, y, false, c),
            (m, x, y, c) -> m.plus(x, c),
            (m, x, y, c) -> m.negate(x, c),
            (m, x, y, c) -> m.abs(x, c),
            (m, x, y, c) -> m.roundToPrecision(x, c),
            (m, x, y, c) -> m.reduce(x, c),
            (m, x, y, c) -> m.roundToExponentExact(x, y.exponent(), c),
            (m, x, y, c) -> m.roundToExponentSimple(x, y.exponent(), c),
            (m, x, y, c) -> m.roundToExponentNoRoundedFlag(x,
                    y.exponent(), c)};

    /** Source of operands and contexts in one radix. */
    private static class Sampler {

        final Random random;
        final int radix;
        final TestNumber.Representation rep;

        Sampler(int radix, long seed) {
            this.random = new Random(seed);
            this.radix = radix;
            this.rep = new TestNumber.Representation(radix);
        }

        TestNumber number() {
            boolean neg = random.nextBoolean();
            switch (random.nextInt(40)) {
                case 0:
                    return rep.infinity(neg);
                case 1:
                    return rep.create(neg, BigInteger.valueOf(3),
                            BigInteger.ZERO, NumberKind.QUIET_NAN);
                case 2:
                    return rep.create(neg, BigInteger.ZERO, BigInteger.ZERO,
                            NumberKind.SIGNALING_NAN);
                case 3:
                case 4:
                    return rep.finite(neg, BigInteger.ZERO, exponent());
                default:
                    break;
            }
            // Up to 12 digits, often with trailing zeros
            int digits = 1 + random.nextInt(12);
            BigInteger m = BigInteger.ZERO;
            for (int i = 0; i < digits; i++) {
                int d = i > 0 && random.nextInt(3) == 0 ? 0
                        : random.nextInt(radix);
                m = m.multiply(BigInteger.valueOf(radix))
                        .add(BigInteger.valueOf(d));
            }
            return rep.finite(neg, m, exponent());
        }

        BigInteger exponent() {
            return BigInteger.valueOf(random.nextInt(17) - 8);
        }

        PrecisionContext context() {
            int p = random.nextInt(10) == 0 ? 0 : 1 + random.nextInt(14);
            Rounding r = Rounding.values()[random
                    .nextInt(Rounding.values().length)];
            PrecisionContext c = PrecisionContext.forPrecisionAndRounding(p,
                    r);
            if (random.nextInt(3) > 0) {
                int eMin = -5 - random.nextInt(11);
                int eMax = 5 + random.nextInt(11);
                c = c.withExponentRange(eMin, eMax)
                        .withClampNormalExponents(random.nextBoolean());
            }
            return c;
        }
    }

    @ParameterizedTest(name = "in radix {0}")
    @ValueSource(ints = {2, 3, 7, 10, 16})
    @DisplayName("on a sample of operations")
    void sample(int radix) {
        Sampler s = new Sampler(radix, 1234L + radix);
        DispatchingRadixMath<TestNumber> math =
                new DispatchingRadixMath<>(s.rep);
        for (int trial = 0; trial < TRIALS; trial++) {
            TestNumber x = s.number(), y = s.number();
            PrecisionContext model = s.context();
            int k = s.random.nextInt(OPS.length);
            String what = String.format("%s(%s, %s) in %s", NAMES[k], x, y,
                    model);

            PrecisionContext cf = model.withBlankFlags();
            PrecisionContext cs = model.withSimplified(true).withBlankFlags();
            TestNumber rf = OPS[k].apply(math, x, y, cf);
            TestNumber rs = OPS[k].apply(math, x, y, cs);
            assertEquals(rf, rs, what);
            assertEquals(cf.getFlags().toSet(), cs.getFlags().toSet(), what);
        }
    }

    @Test
    @DisplayName("and hands over what it cannot do")
    void handOver() {
        DispatchingRadixMath<TestNumber> math =
                new DispatchingRadixMath<>(new TestNumber.Representation(10));
        NumberRepresentation<TestNumber> rep = math.getRepresentation();
        PrecisionContext simplified =
                PrecisionContext.forPrecision(5).withSimplified(true);
        assertSame(math.select(null), math.select(PrecisionContext.BASIC));
        assertNotSame(math.select(null), math.select(simplified));

        // Too much precision for long arithmetic
        PrecisionContext c = PrecisionContext.forPrecision(30)
                .withSimplified(true).withBlankFlags();
        TestNumber r = math.divide(rep.one(), rep.valueOf(3), c);
        assertEquals(30, r.mantissa().toString().length());
        assertEquals(BigInteger.valueOf(-30), r.exponent());
        assertFlags(c, Flag.INEXACT, Flag.ROUNDED);
    }
}
