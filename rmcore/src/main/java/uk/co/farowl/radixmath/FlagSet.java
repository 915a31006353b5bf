// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * A mutable accumulator of {@link Flag}s, the output half of a
 * {@link PrecisionContext}. Operations add to it and never remove
 * from it. Instances are not thread-safe: each thread of computation
 * should have its own, which is easily arranged with
 * {@link PrecisionContext#withBlankFlags()}.
 */
public final class FlagSet {

    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);

    /** Create an empty accumulator. */
    public FlagSet() {}

    /**
     * Add one condition.
     *
     * @param flag to record
     */
    public void add(Flag flag) { flags.add(flag); }

    /**
     * Add all the given conditions.
     *
     * @param raised to record
     */
    public void addAll(Collection<Flag> raised) { flags.addAll(raised); }

    /**
     * @param flag to test
     * @return whether the condition has been recorded
     */
    public boolean contains(Flag flag) { return flags.contains(flag); }

    /** @return whether no condition has been recorded */
    public boolean isEmpty() { return flags.isEmpty(); }

    /**
     * Forget all conditions recorded so far. (This is for the owner of
     * the accumulator: operations never clear flags.)
     */
    public void clear() { flags.clear(); }

    /** @return a snapshot of the recorded conditions */
    public Set<Flag> toSet() { return EnumSet.copyOf(flags); }

    @Override
    public String toString() { return flags.toString(); }
}
