package com.mathparse.expr;

/**
 * Operators recognised by the tokenizer, each with its shunting-yard precedence.
 * FUNCTION stands for any named function call; the name travels on the token.
 */
public enum OperatorKind {
    ADD(1, "+"),
    SUB(1, "-"),
    MUL(2, "*"),
    DIV(2, "/"),
    POW(3, "^"),
    SCI_NOTATION(3, "E"),
    FUNCTION(4, null);

    private final int precedence;
    private final String symbol;

    OperatorKind(int precedence, String symbol) {
        this.precedence = precedence;
        this.symbol = symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isBinary() {
        return this != FUNCTION;
    }
}
