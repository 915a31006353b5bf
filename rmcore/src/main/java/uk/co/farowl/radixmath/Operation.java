// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

/**
 * The operations of {@link RadixMath}, named for diagnostic messages
 * and logging, and classified by what the simplified engine does with
 * them.
 */
public enum Operation {

    // @formatter:off
    ADD("add", true),
    ADD_EX("addEx", true),
    MULTIPLY("multiply", true),
    MULTIPLY_AND_ADD("multiplyAndAdd", false),
    DIVIDE("divide", true),
    DIVIDE_TO_EXPONENT("divideToExponent", false),
    DIVIDE_TO_INTEGER_NATURAL_SCALE("divideToIntegerNaturalScale", false),
    DIVIDE_TO_INTEGER_ZERO_SCALE("divideToIntegerZeroScale", false),
    REMAINDER("remainder", false),
    REMAINDER_NEAR("remainderNear", false),
    NEGATE("negate", true),
    ABS("abs", true),
    COMPARE_TO_WITH_CONTEXT("compareToWithContext", true),
    COMPARE_TO("compareTo", false),
    MIN("min", true),
    MAX("max", true),
    MIN_MAGNITUDE("minMagnitude", true),
    MAX_MAGNITUDE("maxMagnitude", true),
    ROUND_TO_PRECISION("roundToPrecision", true),
    ROUND_TO_BINARY_PRECISION("roundToBinaryPrecision", false),
    ROUND_AFTER_CONVERSION("roundAfterConversion", false),
    PLUS("plus", true),
    QUANTIZE("quantize", true),
    ROUND_TO_EXPONENT_EXACT("roundToExponentExact", true),
    ROUND_TO_EXPONENT_SIMPLE("roundToExponentSimple", true),
    ROUND_TO_EXPONENT_NO_ROUNDED_FLAG("roundToExponentNoRoundedFlag", true),
    REDUCE("reduce", true),
    NEXT_MINUS("nextMinus", false),
    NEXT_PLUS("nextPlus", false),
    NEXT_TOWARD("nextToward", false),
    PI("pi", false),
    POWER("power", false),
    LOG10("log10", false),
    LN("ln", false),
    EXP("exp", false),
    SQUARE_ROOT("squareRoot", false);
    // @formatter:on

    /** Method name implementing the operation e.g. "add" for ADD. */
    public final String symbol;

    /**
     * Whether the simplified engine has a fast path for the operation.
     * When it does not, it always delegates to the full engine.
     */
    public final boolean hasFastPath;

    private Operation(String symbol, boolean hasFastPath) {
        this.symbol = symbol;
        this.hasFastPath = hasFastPath;
    }
}
