package com.mathparse.expr;

/**
 * Base class for every structural failure raised while turning text into an expression tree.
 * Numeric edge cases (division by zero, square root of a negative) are not errors; they
 * evaluate to infinity or NaN.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
