package com.mathparse.expr;

public class MalformedNumberException extends ExpressionException {

    private final String lexeme;

    public MalformedNumberException(String lexeme, Throwable cause) {
        super("Malformed number: '" + lexeme + "'", cause);
        this.lexeme = lexeme;
    }

    public String getLexeme() {
        return lexeme;
    }
}
