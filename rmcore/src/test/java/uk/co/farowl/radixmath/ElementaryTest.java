// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * The transcendental functions, square root and power, which are
 * correctly rounded to the precision of the context.
 */
@DisplayName("The elementary functions")
class ElementaryTest extends UnitTestSupport {

    private static final Set<Flag> INEXACT = flags(Flag.INEXACT,
            Flag.ROUNDED);

    abstract static class Examples {

        static Stream<Arguments> expExamples() {
            return Stream.of( //
                    arguments("1", "2.71828183", INEXACT), //
                    arguments("0", "1", flags()), //
                    arguments("-Infinity", "0", flags()), //
                    arguments("Infinity", "Infinity", flags()), //
                    arguments("-1", "0.367879441", INEXACT), //
                    arguments("2.302585093", "10.0000000", INEXACT));
        }

        static Stream<Arguments> lnExamples() {
            return Stream.of( //
                    arguments("10", "2.30258509", INEXACT), //
                    arguments("1", "0", flags()), //
                    arguments("0", "-Infinity", flags()), //
                    arguments("Infinity", "Infinity", flags()), //
                    arguments("-1", "NaN", flags(Flag.INVALID)), //
                    arguments("2", "0.693147181", INEXACT));
        }

        static Stream<Arguments> log10Examples() {
            return Stream.of( //
                    arguments("100", "2", flags()), //
                    arguments("0.001", "-3", flags()), //
                    arguments("1", "0", flags()), //
                    arguments("2", "0.301029996", INEXACT), //
                    arguments("0", "-Infinity", flags()), //
                    arguments("-2", "NaN", flags(Flag.INVALID)));
        }

        static Stream<Arguments> sqrtExamples() {
            return Stream.of( //
                    arguments("2", "1.41421356", INEXACT), //
                    arguments("0.25", "0.5", flags()), //
                    arguments("100", "10", flags()), //
                    arguments("-0", "-0", flags()), //
                    arguments("Infinity", "Infinity", flags()), //
                    arguments("-1", "NaN", flags(Flag.INVALID)));
        }

        static Stream<Arguments> powerExamples() {
            return Stream.of( //
                    arguments("2", "10", "1024", flags()), //
                    arguments("2", "-2", "0.25", flags()), //
                    arguments("2", "0.5", "1.41421356", INEXACT), //
                    arguments("4", "0.5", "2", flags()), //
                    arguments("0", "0", "NaN", flags(Flag.INVALID)), //
                    arguments("-2", "3", "-8", flags()), //
                    arguments("-2", "0.5", "NaN", flags(Flag.INVALID)));
        }
    }

    /**
     * Check a unary function in nine digits under both engines.
     */
    static void check(ArithmeticTest.Unary f, String x, String expected,
            Set<Flag> raised) {
        ArithmeticTest.check(f, NINE, x, expected, raised);
    }

    @Nested
    @DisplayName("exp, ln and log10")
    class LogarithmTest extends Examples {

        @DisplayName("exp(x)")
        @ParameterizedTest(name = "exp({0}) = {1}")
        @MethodSource("expExamples")
        void exp(String x, String expected, Set<Flag> raised) {
            check(MATH::exp, x, expected, raised);
        }

        @DisplayName("ln(x)")
        @ParameterizedTest(name = "ln({0}) = {1}")
        @MethodSource("lnExamples")
        void ln(String x, String expected, Set<Flag> raised) {
            check(MATH::ln, x, expected, raised);
        }

        @DisplayName("log10(x)")
        @ParameterizedTest(name = "log10({0}) = {1}")
        @MethodSource("log10Examples")
        void log10(String x, String expected, Set<Flag> raised) {
            check(MATH::log10, x, expected, raised);
        }
    }

    @Nested
    @DisplayName("square root and power")
    class PowerTest extends Examples {

        @DisplayName("sqrt(x)")
        @ParameterizedTest(name = "sqrt({0}) = {1}")
        @MethodSource("sqrtExamples")
        void sqrt(String x, String expected, Set<Flag> raised) {
            check(MATH::squareRoot, x, expected, raised);
        }

        @DisplayName("x ** y")
        @ParameterizedTest(name = "{0} ** {1} = {2}")
        @MethodSource("powerExamples")
        void power(String x, String y, String expected, Set<Flag> raised) {
            ArithmeticTest.check(MATH::power, x, y, expected, raised);
        }
    }

    @Nested
    @DisplayName("pi")
    class PiTest {

        @Test
        @DisplayName("in nine digits")
        void nine() {
            PrecisionContext ctx = fresh(NINE, false);
            assertNumber("3.14159265", MATH.pi(ctx));
            assertFlags(ctx, Flag.INEXACT, Flag.ROUNDED);
        }

        @Test
        @DisplayName("in five digits")
        void five() { assertNumber("3.1416", MATH.pi(context(5))); }

        @Test
        @DisplayName("in 40 digits")
        void forty() {
            assertNumber("3.141592653589793238462643383279502884197",
                    MATH.pi(context(40)));
        }

        @Test
        @DisplayName("in binary to double precision")
        void binary() {
            BinaryNumber pi = BinaryNumber.MATH.pi(PrecisionContext.BINARY64);
            assertEquals(Math.PI, pi.toDouble());
        }
    }

    @Test
    @DisplayName("give NaN at unlimited precision where inexact")
    void unlimited() {
        PrecisionContext ctx = context(0);
        assertTrue(MATH.exp(dec("1"), ctx).isNaN());
        assertFlags(ctx, Flag.INVALID);
    }

    @Test
    @DisplayName("give NaN where an unlimited exponent is impractical")
    void unlimitedExponent() {
        PrecisionContext ctx = context(9);
        assertTrue(MATH.exp(dec("1E+1001"), ctx).isNaN());
        assertFlags(ctx, Flag.INVALID);

        ctx = context(9);
        assertTrue(MATH.exp(dec("-1E+1001"), ctx).isNaN());
        assertFlags(ctx, Flag.INVALID);

        ctx = context(9);
        DecimalNumber r = MATH.power(dec("1.5"), dec("1E+1005"), ctx);
        assertTrue(r.isNaN());
        assertFalse(r.isNegative());
        assertFlags(ctx, Flag.INVALID);

        ctx = context(9);
        r = MATH.power(dec("-1.5"), dec("1E+1005"), ctx);
        assertTrue(r.isNaN());
        assertFalse(r.isNegative());
        assertFlags(ctx, Flag.INVALID);

        // Large but practical
        ctx = context(9);
        assertTrue(MATH.exp(dec("1E+30"), ctx).isFinite());
        assertFlags(ctx, Flag.INEXACT, Flag.ROUNDED);
    }

    @Test
    @DisplayName("are exact at unlimited precision where they can be")
    void unlimitedExact() {
        PrecisionContext ctx = context(0);
        assertNumber("1", MATH.exp(dec("0"), ctx));
        assertNumber("12", MATH.squareRoot(dec("144"), ctx));
        assertNumber("1024", MATH.power(dec("2"), dec("10"), ctx));
        assertTrue(ctx.getFlags().isEmpty());
    }
}
