package com.mathparse.expr;

/**
 * Lexical categories produced by {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    OPERATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    COMMA
}
