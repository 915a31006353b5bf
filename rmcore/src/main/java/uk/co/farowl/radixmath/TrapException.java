// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thrown by an arithmetic operation when it raises a condition that
 * the context traps. By the time this is thrown, all the conditions
 * the operation raised have been recorded in the flag accumulator of
 * the context (if it has one). The value the operation would have
 * returned, had nothing trapped, is available from {@link #getResult()},
 * but callers should not depend on it.
 */
public class TrapException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    /** Logger for traps. */
    static final Logger logger = LoggerFactory.getLogger(TrapException.class);

    private final Flag flag;
    private final Set<Flag> raised;
    private final transient PrecisionContext context;
    private final transient Object result;

    /**
     * Create an exception reporting the trapped condition.
     *
     * @param operation in which the condition arose
     * @param flag the (highest-priority) trapped condition
     * @param raised all conditions raised by the operation
     * @param context in force during the operation
     * @param result that would have been returned
     */
    public TrapException(Operation operation, Flag flag, Set<Flag> raised,
            PrecisionContext context, Object result) {
        super(String.format("%s trapped in %s", flag, operation.symbol));
        this.flag = flag;
        this.raised = Collections.unmodifiableSet(EnumSet.copyOf(raised));
        this.context = context;
        this.result = result;
        logger.atDebug().setMessage("{} (result would be {})")
                .addArgument(this::getMessage).addArgument(result).log();
    }

    /** @return the condition that trapped */
    public Flag getFlag() { return flag; }

    /** @return every condition the operation raised */
    public Set<Flag> getRaised() { return raised; }

    /** @return the context in force */
    public PrecisionContext getContext() { return context; }

    /**
     * The value the operation would have returned had the condition not
     * been trapped.
     *
     * @param <T> expected type of the value
     * @return the value
     */
    @SuppressWarnings("unchecked")
    public <T> T getResult() { return (T)result; }
}
