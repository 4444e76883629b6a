package com.mathparse.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Makes juxtaposition explicit: {@code 2(3)}, {@code (2)(3)}, {@code (2)3}, {@code 2sqrt(9)} and
 * {@code (2)sqrt(9)} get a multiplication token between the adjacent terms.
 */
public class ImplicitMultiplicationExpander {

    public List<Token> expand(List<Token> tokens) {
        List<Token> expanded = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            Token current = tokens.get(i);
            expanded.add(current);
            if (i + 1 < tokens.size() && juxtaposed(current, tokens.get(i + 1))) {
                expanded.add(Token.operator(OperatorKind.MUL));
            }
        }
        return expanded;
    }

    private boolean juxtaposed(Token left, Token right) {
        if (left.isNumber()) {
            return right.is(TokenType.OPEN_PAREN) || right.isFunction();
        }
        if (left.is(TokenType.CLOSE_PAREN)) {
            return right.isNumber() || right.isFunction() || right.is(TokenType.OPEN_PAREN);
        }
        return false;
    }
}
