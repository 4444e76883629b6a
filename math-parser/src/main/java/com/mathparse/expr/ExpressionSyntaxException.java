package com.mathparse.expr;

public class ExpressionSyntaxException extends ExpressionException {

    public ExpressionSyntaxException(String message) {
        super(message);
    }
}
