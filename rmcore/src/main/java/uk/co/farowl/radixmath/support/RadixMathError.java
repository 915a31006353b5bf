// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the arithmetic implementation finds itself
 * in a state its own invariants exclude. An arithmetic condition (that a
 * caller might trap or inspect as a flag) is not then appropriate. A
 * {@code RadixMathError} means there is a bug here, not in the caller.
 */
public class RadixMathError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for internal errors. They are logged as they are created
     * because a caller catching {@code RuntimeException} wholesale might
     * otherwise hide them.
     */
    static final Logger logger =
            LoggerFactory.getLogger(RadixMathError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public RadixMathError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the internal error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public RadixMathError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(cause.getMessage());
    }
}
