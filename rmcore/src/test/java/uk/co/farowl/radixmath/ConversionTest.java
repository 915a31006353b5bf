// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Conversion of numbers to and from text, {@code double} and the other
 * radix.
 */
@DisplayName("Conversion")
class ConversionTest extends UnitTestSupport {

    /**
     * Assert two doubles are the same, distinguishing the zeros.
     */
    static void assertSameDouble(double expected, double actual) {
        assertEquals(Double.doubleToLongBits(expected),
                Double.doubleToLongBits(actual),
                () -> String.format("expected %s but was %s", expected,
                        actual));
    }

    abstract static class Examples {

        static Stream<String> textExamples() {
            return Stream.of("0", "-0", "-0.00", "1.23E+5", "12.5",
                    "0.000001", "1E-7", "Infinity", "-Infinity", "NaN",
                    "-sNaN7", "NaN123");
        }

        static Stream<Arguments> doubleExamples() {
            return Stream.of( //
                    arguments(1.5, "3p-1"), //
                    arguments(1.0, "1"), //
                    arguments(-0.0, "-0"), //
                    arguments(0.0, "0"), //
                    arguments(1024.0, "1p10"), //
                    arguments(Double.MIN_VALUE, "1p-1074"), //
                    arguments(Double.NEGATIVE_INFINITY, "-Infinity"), //
                    arguments(Double.NaN, "NaN"));
        }

        static Stream<Arguments> decimalToDoubleExamples() {
            return Stream.of( //
                    arguments("0.1", 0.1), //
                    arguments("123456.789", 123456.789), //
                    arguments("-2.5", -2.5), //
                    arguments("1E+400", Double.POSITIVE_INFINITY), //
                    arguments("-1E-400", -0.0), //
                    arguments("1.7976931348623157E+308", Double.MAX_VALUE),
                    arguments("2.2250738585072014E-308", Double.MIN_NORMAL),
                    arguments("4.9E-324", Double.MIN_VALUE), //
                    arguments("-Infinity", Double.NEGATIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("of decimal text")
    class TextTest extends Examples {

        @DisplayName("survives a round trip")
        @ParameterizedTest(name = "\"{0}\"")
        @MethodSource("textExamples")
        void roundTrip(String s) {
            assertEquals(s, dec(s).toString());
        }

        @Test
        @DisplayName("accepts special values in any case")
        void specials() {
            assertNumber("Infinity", dec("inf"));
            assertNumber("-Infinity", dec("-INFINITY"));
            assertNumber("NaN", dec("nan"));
            assertNumber("sNaN2", dec("SNAN2"));
            assertNumber("12", dec("+12"));
        }

        @DisplayName("rejects what is not a number")
        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"", "abc", "--1", "+-1", "NaNx", "1e",
                "sNaN-1", "1e5e5", "1E+", "e5", "1E--2"})
        void reject(String s) {
            assertThrows(NumberFormatException.class, () -> dec(s));
        }

        @Test
        @DisplayName("gives an exponent beyond BigDecimal in plain form")
        void hugeExponent() {
            DecimalNumber d = MATH.getRepresentation().finite(false,
                    BigInteger.valueOf(12), BigInteger.valueOf(3_000_000_000L));
            assertNumber("12E+3000000000", d);
            assertThrows(ArithmeticException.class, () -> d.toBigDecimal());
            assertEquals(d, dec("12E+3000000000"));
        }

        @Test
        @DisplayName("reads back an exponent beyond BigDecimal")
        void hugeExponentRoundTrip() {
            for (String s : new String[] {
                    "402793352E+434294481903251827651128918908",
                    "-1.5E-99999999999999999999", "0E+12345678901"}) {
                DecimalNumber d = dec(s);
                assertEquals(d, dec(d.toString()), s);
            }
            DecimalNumber d = dec("-1.5E-99999999999999999999");
            assertEquals(new BigInteger("-100000000000000000000"),
                    d.getExponent());
            assertEquals(BigInteger.valueOf(15), d.getMantissa());
        }

        @Test
        @DisplayName("agrees with BigDecimal")
        void bigDecimal() {
            BigDecimal b = new BigDecimal("-123.4500");
            DecimalNumber d = DecimalNumber.of(b);
            assertNumber("-123.4500", d);
            assertEquals(b, d.toBigDecimal());
            assertNumber("-1.5E+3", DecimalNumber.of(-15, 2));
        }
    }

    @Nested
    @DisplayName("of a double")
    class DoubleTest extends Examples {

        @DisplayName("is exact")
        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("doubleExamples")
        void fromDouble(double v, String expected) {
            assertNumber(expected, BinaryNumber.fromDouble(v));
        }

        @DisplayName("survives a round trip")
        @ParameterizedTest(name = "{0}")
        @ValueSource(doubles = {0.1, 1.0 / 3.0, Double.MAX_VALUE,
                Double.MIN_VALUE, Double.MIN_NORMAL, -2.5e-310, 123456.789,
                -0.0, Double.POSITIVE_INFINITY})
        void roundTrip(double v) {
            assertSameDouble(v, BinaryNumber.fromDouble(v).toDouble());
            assertSameDouble(v,
                    BinaryNumber.fromDouble(v).toDecimal().toDouble());
        }

        @Test
        @DisplayName("keeps a signaling NaN")
        void signalingNaN() {
            double snan = Double.longBitsToDouble(0x7ff0_0000_0000_0005L);
            BinaryNumber b = BinaryNumber.fromDouble(snan);
            assertEquals(NumberKind.SIGNALING_NAN, b.getKind());
            assertNumber("sNaN5", b);
            assertTrue(Double.isNaN(b.toDouble()));
        }

        @Test
        @DisplayName("has an exact decimal expansion")
        void toDecimal() {
            assertNumber(
                    "0.1000000000000000055511151231257827021181583404541015625",
                    BinaryNumber.fromDouble(0.1).toDecimal());
            assertNumber("1024", BinaryNumber.fromDouble(1024.0).toDecimal());
        }
    }

    @Nested
    @DisplayName("of a decimal to binary")
    class DecimalToBinaryTest extends Examples {

        @DisplayName("gives the nearest double")
        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("decimalToDoubleExamples")
        void toDouble(String s, double expected) {
            assertSameDouble(expected, dec(s).toDouble());
        }

        @Test
        @DisplayName("rounds to single precision")
        void toBinary32() {
            BinaryNumber b = dec("1.5").toBinary(PrecisionContext.BINARY32);
            assertNumber("3p-1", b);
            assertEquals((double)0.1f,
                    dec("0.1").toBinary(PrecisionContext.BINARY32)
                            .toDouble());
        }

        @Test
        @DisplayName("is exact without a context where it can be")
        void unlimited() {
            assertNumber("1p-1", dec("0.5").toBinary(null));
            assertNumber("25", dec("25").toBinary(null));
            assertTrue(dec("0.1").toBinary(null).isNaN());
        }

        @Test
        @DisplayName("reports the inexact conversion")
        void inexact() {
            PrecisionContext ctx =
                    PrecisionContext.BINARY64.withBlankFlags();
            dec("0.1").toBinary(ctx);
            assertFlags(ctx, Flag.INEXACT, Flag.ROUNDED);
        }
    }
}
