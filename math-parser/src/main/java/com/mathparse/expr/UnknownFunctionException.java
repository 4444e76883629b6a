package com.mathparse.expr;

public class UnknownFunctionException extends ExpressionException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
