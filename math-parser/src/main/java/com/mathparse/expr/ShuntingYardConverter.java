package com.mathparse.expr;

import com.mathparse.util.LoggingUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Infix to postfix conversion. Besides the usual precedence handling, every function call in the
 * output is preceded by a synthetic number literal holding its argument count, so that
 * {@link TreeBuilder} can collect variadic arguments from its stack.
 */
public class ShuntingYardConverter {

    public List<Token> toPostfix(List<Token> tokens) {
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> stack = new ArrayDeque<>();
        Token previous = null;

        for (Token token : tokens) {
            switch (token.getType()) {
                case NUMBER -> output.add(token);
                case OPEN_PAREN -> stack.push(token);
                case OPERATOR -> {
                    // equal precedence pops too, so ^ and E associate to the left
                    while (!stack.isEmpty() && stack.peek().precedence() >= token.precedence()) {
                        emitOperator(stack.pop(), output);
                    }
                    stack.push(token);
                }
                case CLOSE_PAREN -> closeGroup(previous, stack, output);
                case COMMA -> {
                    if (previous == null || previous.is(TokenType.OPEN_PAREN) || previous.is(TokenType.COMMA)) {
                        throw new ExpressionSyntaxException("Empty function argument");
                    }
                    while (!stack.isEmpty()
                            && !stack.peek().is(TokenType.OPEN_PAREN)
                            && !stack.peek().is(TokenType.COMMA)) {
                        emitOperator(stack.pop(), output);
                    }
                    if (stack.isEmpty()) {
                        throw new ExpressionSyntaxException("Comma outside of a function argument list");
                    }
                    stack.push(token);
                }
            }
            previous = token;
        }

        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.is(TokenType.OPEN_PAREN)) {
                throw new ExpressionSyntaxException("Unbalanced parentheses: missing ')'");
            }
            if (top.is(TokenType.COMMA)) {
                throw new ExpressionSyntaxException("Comma outside of a function argument list");
            }
            emitOperator(top, output);
        }

        LoggingUtil.debug("toPostfix: " + output);
        return output;
    }

    private void closeGroup(Token previous, Deque<Token> stack, List<Token> output) {
        if (previous != null && previous.is(TokenType.OPEN_PAREN)) {
            throw new ExpressionSyntaxException("Empty parentheses");
        }
        if (previous != null && previous.is(TokenType.COMMA)) {
            throw new ExpressionSyntaxException("Empty function argument");
        }

        int commas = 0;
        boolean opened = false;
        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.is(TokenType.OPEN_PAREN)) {
                opened = true;
                break;
            }
            if (top.is(TokenType.COMMA)) {
                commas++;
            } else {
                emitOperator(top, output);
            }
        }
        if (!opened) {
            throw new ExpressionSyntaxException("Unbalanced parentheses: unexpected ')'");
        }

        Token owner = stack.peek();
        if (owner != null && owner.isFunction()) {
            stack.pop();
            output.add(Token.number(commas + 1));
            output.add(owner);
        } else if (commas > 0) {
            throw new ExpressionSyntaxException("Comma outside of a function argument list");
        }
    }

    /**
     * Functions only leave the stack through their closing parenthesis; anything else means the
     * name was not followed by an argument list.
     */
    private void emitOperator(Token operator, List<Token> output) {
        if (operator.isFunction()) {
            throw new ExpressionSyntaxException("Function " + operator.getFunctionName()
                    + " is missing its argument list");
        }
        output.add(operator);
    }
}
