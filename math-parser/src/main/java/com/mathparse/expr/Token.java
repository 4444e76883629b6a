package com.mathparse.expr;

import java.util.Objects;

public final class Token {

    private static final Token OPEN_PAREN = new Token(TokenType.OPEN_PAREN, 0.0, null, null);
    private static final Token CLOSE_PAREN = new Token(TokenType.CLOSE_PAREN, 0.0, null, null);
    private static final Token COMMA = new Token(TokenType.COMMA, 0.0, null, null);

    private final TokenType type;
    private final double value;
    private final OperatorKind operator;
    private final String functionName;

    private Token(TokenType type, double value, OperatorKind operator, String functionName) {
        this.type = type;
        this.value = value;
        this.operator = operator;
        this.functionName = functionName;
    }

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, value, null, null);
    }

    public static Token operator(OperatorKind kind) {
        if (kind == OperatorKind.FUNCTION) {
            throw new IllegalArgumentException("Function tokens need a name; use Token.function(name)");
        }
        return new Token(TokenType.OPERATOR, 0.0, kind, null);
    }

    public static Token function(String name) {
        Objects.requireNonNull(name, "name");
        return new Token(TokenType.OPERATOR, 0.0, OperatorKind.FUNCTION, name);
    }

    public static Token openParen() {
        return OPEN_PAREN;
    }

    public static Token closeParen() {
        return CLOSE_PAREN;
    }

    public static Token comma() {
        return COMMA;
    }

    public TokenType getType() {
        return type;
    }

    public double getValue() {
        return value;
    }

    public OperatorKind getOperator() {
        return operator;
    }

    public String getFunctionName() {
        return functionName;
    }

    public boolean isNumber() {
        return type == TokenType.NUMBER;
    }

    public boolean isOperator() {
        return type == TokenType.OPERATOR;
    }

    public boolean isFunction() {
        return operator == OperatorKind.FUNCTION;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * Shunting-yard precedence; 0 for anything that is not an operator.
     */
    public int precedence() {
        return operator != null ? operator.getPrecedence() : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type
                && Double.compare(value, other.value) == 0
                && operator == other.operator
                && Objects.equals(functionName, other.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, operator, functionName);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> String.valueOf(value);
            case OPERATOR -> isFunction() ? functionName : operator.getSymbol();
            case OPEN_PAREN -> "(";
            case CLOSE_PAREN -> ")";
            case COMMA -> ",";
        };
    }
}
