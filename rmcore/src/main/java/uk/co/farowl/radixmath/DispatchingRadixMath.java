// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.math.BigInteger;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.radixmath.kernel.FullRadixMath;
import uk.co.farowl.radixmath.kernel.SimpleRadixMath;

/**
 * The arithmetic of one number representation, choosing for each call
 * between the full engine and the simplified engine according to the
 * context. A {@code null} context, or one without
 * {@link PrecisionContext#isSimplified()}, selects the full engine.
 * <p>
 * The choice affects only speed: both engines return the same values
 * and raise the same conditions.
 *
 * @param <T> the number type
 */
public class DispatchingRadixMath<T> implements RadixMath<T> {

    /** Logger for the dispatching facade. */
    static final Logger logger =
            LoggerFactory.getLogger(DispatchingRadixMath.class);

    private final FullRadixMath<T> full;
    private final SimpleRadixMath<T> simple;

    /**
     * Create the arithmetic for a representation.
     *
     * @param rep of the numbers
     */
    public DispatchingRadixMath(NumberRepresentation<T> rep) {
        this.full = new FullRadixMath<>(rep);
        this.simple = new SimpleRadixMath<>(full);
        logger.atDebug().setMessage("arithmetic for {} (radix {})")
                .addArgument(() -> rep.getClass().getSimpleName())
                .addArgument(rep::radix).log();
    }

    /**
     * The engine that handles calls under the given context.
     *
     * @param ctx context or {@code null}
     * @return the engine
     */
    RadixMath<T> select(PrecisionContext ctx) {
        return ctx == null || !ctx.isSimplified() ? full : simple;
    }

    @Override
    public NumberRepresentation<T> getRepresentation() {
        return full.getRepresentation();
    }

    @Override
    public T add(T x, T y, PrecisionContext ctx) {
        return select(ctx).add(x, y, ctx);
    }

    @Override
    public T addEx(T x, T y, PrecisionContext ctx,
            boolean roundToOperandPrecision) {
        return select(ctx).addEx(x, y, ctx, roundToOperandPrecision);
    }

    @Override
    public T multiply(T x, T y, PrecisionContext ctx) {
        return select(ctx).multiply(x, y, ctx);
    }

    @Override
    public T multiplyAndAdd(T x, T y, T z, PrecisionContext ctx) {
        return select(ctx).multiplyAndAdd(x, y, z, ctx);
    }

    @Override
    public T divide(T x, T y, PrecisionContext ctx) {
        return select(ctx).divide(x, y, ctx);
    }

    @Override
    public T divideToExponent(T x, T y, BigInteger exponent,
            PrecisionContext ctx) {
        return select(ctx).divideToExponent(x, y, exponent, ctx);
    }

    @Override
    public T divideToIntegerNaturalScale(T x, T y, PrecisionContext ctx) {
        return select(ctx).divideToIntegerNaturalScale(x, y, ctx);
    }

    @Override
    public T divideToIntegerZeroScale(T x, T y, PrecisionContext ctx) {
        return select(ctx).divideToIntegerZeroScale(x, y, ctx);
    }

    @Override
    public T remainder(T x, T y, PrecisionContext ctx) {
        return select(ctx).remainder(x, y, ctx);
    }

    @Override
    public T remainderNear(T x, T y, PrecisionContext ctx) {
        return select(ctx).remainderNear(x, y, ctx);
    }

    @Override
    public T negate(T x, PrecisionContext ctx) {
        return select(ctx).negate(x, ctx);
    }

    @Override
    public T abs(T x, PrecisionContext ctx) {
        return select(ctx).abs(x, ctx);
    }

    @Override
    public T compareToWithContext(T x, T y,
            boolean treatQuietNansAsSignaling, PrecisionContext ctx) {
        return select(ctx).compareToWithContext(x, y,
                treatQuietNansAsSignaling, ctx);
    }

    @Override
    public int compareTo(T x, T y) { return full.compareTo(x, y); }

    @Override
    public T min(T x, T y, PrecisionContext ctx) {
        return select(ctx).min(x, y, ctx);
    }

    @Override
    public T max(T x, T y, PrecisionContext ctx) {
        return select(ctx).max(x, y, ctx);
    }

    @Override
    public T minMagnitude(T x, T y, PrecisionContext ctx) {
        return select(ctx).minMagnitude(x, y, ctx);
    }

    @Override
    public T maxMagnitude(T x, T y, PrecisionContext ctx) {
        return select(ctx).maxMagnitude(x, y, ctx);
    }

    @Override
    public T roundToPrecision(T x, PrecisionContext ctx) {
        return select(ctx).roundToPrecision(x, ctx);
    }

    @Override
    public T roundToBinaryPrecision(T x, PrecisionContext ctx) {
        return select(ctx).roundToBinaryPrecision(x, ctx);
    }

    @Override
    public T roundAfterConversion(T x, PrecisionContext ctx) {
        return select(ctx).roundAfterConversion(x, ctx);
    }

    @Override
    public T plus(T x, PrecisionContext ctx) {
        return select(ctx).plus(x, ctx);
    }

    @Override
    public T quantize(T x, T y, PrecisionContext ctx) {
        return select(ctx).quantize(x, y, ctx);
    }

    @Override
    public T roundToExponentExact(T x, BigInteger exponent,
            PrecisionContext ctx) {
        return select(ctx).roundToExponentExact(x, exponent, ctx);
    }

    @Override
    public T roundToExponentSimple(T x, BigInteger exponent,
            PrecisionContext ctx) {
        return select(ctx).roundToExponentSimple(x, exponent, ctx);
    }

    @Override
    public T roundToExponentNoRoundedFlag(T x, BigInteger exponent,
            PrecisionContext ctx) {
        return select(ctx).roundToExponentNoRoundedFlag(x, exponent, ctx);
    }

    @Override
    public T reduce(T x, PrecisionContext ctx) {
        return select(ctx).reduce(x, ctx);
    }

    @Override
    public T nextMinus(T x, PrecisionContext ctx) {
        return select(ctx).nextMinus(x, ctx);
    }

    @Override
    public T nextPlus(T x, PrecisionContext ctx) {
        return select(ctx).nextPlus(x, ctx);
    }

    @Override
    public T nextToward(T x, T y, PrecisionContext ctx) {
        return select(ctx).nextToward(x, y, ctx);
    }

    @Override
    public T pi(PrecisionContext ctx) {
        Objects.requireNonNull(ctx, "pi requires a precision context");
        return select(ctx).pi(ctx);
    }

    @Override
    public T power(T x, T y, PrecisionContext ctx) {
        return select(ctx).power(x, y, ctx);
    }

    @Override
    public T log10(T x, PrecisionContext ctx) {
        return select(ctx).log10(x, ctx);
    }

    @Override
    public T ln(T x, PrecisionContext ctx) {
        return select(ctx).ln(x, ctx);
    }

    @Override
    public T exp(T x, PrecisionContext ctx) {
        return select(ctx).exp(x, ctx);
    }

    @Override
    public T squareRoot(T x, PrecisionContext ctx) {
        return select(ctx).squareRoot(x, ctx);
    }
}
