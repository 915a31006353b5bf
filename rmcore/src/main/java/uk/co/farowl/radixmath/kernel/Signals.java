// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.kernel;

import java.util.EnumSet;
import java.util.Set;

import uk.co.farowl.radixmath.Flag;
import uk.co.farowl.radixmath.Operation;
import uk.co.farowl.radixmath.PrecisionContext;
import uk.co.farowl.radixmath.TrapException;

/**
 * The last step of every public operation in either engine: record the
 * conditions raised in the accumulator of the caller's context, then
 * throw if any of them is trapped. Operations compute into a local set
 * of flags and only report here, so that internal steps (an exact
 * product inside a fused multiply-add, say) never trap on their own.
 */
final class Signals {

    private Signals() {}  // no instances

    /**
     * Report the conditions raised by an operation and return its
     * result, or throw if a condition is trapped.
     *
     * @param <T> type of result
     * @param op the operation reporting
     * @param ctx the context as the caller gave it (may be {@code null})
     * @param raised conditions raised by the operation
     * @param result of the operation
     * @return {@code result}
     * @throws TrapException naming the first trapped condition in
     *     priority order
     */
    static <T> T report(Operation op, PrecisionContext ctx,
            Set<Flag> raised, T result) throws TrapException {
        if (ctx == null || raised.isEmpty()) { return result; }
        if (ctx.hasFlags()) { ctx.getFlags().addAll(raised); }
        // Flag declaration order is the priority order
        for (Flag f : raised) {
            if (ctx.isTrapped(f)) {
                throw new TrapException(op, f, raised, ctx, result);
            }
        }
        return result;
    }

    /** @return an empty set in which to collect conditions */
    static EnumSet<Flag> none() { return EnumSet.noneOf(Flag.class); }
}
