package com.mathparse.expr;

public class ArityMismatchException extends ExpressionException {

    private final String functionName;
    private final Arity expected;
    private final int actual;

    public ArityMismatchException(String functionName, Arity expected, int actual) {
        super("Function " + functionName + " expects " + expected + " but got " + actual);
        this.functionName = functionName;
        this.expected = expected;
        this.actual = actual;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Arity getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
