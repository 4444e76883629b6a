package com.mathparse.expr;

/**
 * Defines how {@link MathParser#evaluateAll} handles an entry that fails to parse.
 */
public enum BatchFailureMode {
    /**
     * Rethrow the first failure.
     */
    EXCEPTION,

    /**
     * Log a warning, record null for the entry and continue.
     */
    WARNING
}
