package com.mathparse.expr;

/**
 * Tag of the closed set of {@link ExpressionNode} variants.
 */
public enum NodeKind {
    LITERAL,
    BINARY_OP,
    CALL
}
