package com.mathparse.expr;

import com.mathparse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Single pass scanner. Numbers and function names span several characters and are collected
 * in their own buffers; every other lexeme is exactly one character.
 */
public class Tokenizer {

    public List<Token> scan(String input) {
        List<Token> tokens = new ArrayList<>();
        if (input == null) return tokens;

        StringBuilder number = new StringBuilder();
        StringBuilder function = new StringBuilder();

        for (int pos = 0; pos < input.length(); pos++) {
            char c = input.charAt(pos);

            if (isNumberChar(c)) {
                flushFunction(function, tokens);
                number.append(c);
                continue;
            }
            if (isLowercase(c)) {
                flushNumber(number, tokens);
                function.append(c);
                continue;
            }

            flushNumber(number, tokens);
            flushFunction(function, tokens);

            switch (c) {
                case '+' -> tokens.add(Token.operator(OperatorKind.ADD));
                case '-' -> {
                    if (startsOperand(tokens)) {
                        number.append('-');
                    } else {
                        tokens.add(Token.operator(OperatorKind.SUB));
                    }
                }
                case '*' -> tokens.add(Token.operator(OperatorKind.MUL));
                case '/' -> tokens.add(Token.operator(OperatorKind.DIV));
                case '^' -> tokens.add(Token.operator(OperatorKind.POW));
                case 'E' -> tokens.add(Token.operator(OperatorKind.SCI_NOTATION));
                case '(' -> tokens.add(Token.openParen());
                case ')' -> tokens.add(Token.closeParen());
                case ',' -> tokens.add(Token.comma());
                default -> {
                    // whitespace and unrecognised characters produce no token
                }
            }
        }

        flushNumber(number, tokens);
        flushFunction(function, tokens);

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("scan: '" + input + "' -> " + tokens);
        }
        return tokens;
    }

    /**
     * A minus sign opens a negative literal when nothing precedes it or when the previous token
     * cannot end an operand.
     */
    private boolean startsOperand(List<Token> tokens) {
        if (tokens.isEmpty()) return true;
        Token last = tokens.get(tokens.size() - 1);
        return last.is(TokenType.OPEN_PAREN) || last.isOperator() || last.is(TokenType.COMMA);
    }

    private void flushNumber(StringBuilder number, List<Token> tokens) {
        if (number.length() == 0) return;
        String lexeme = number.toString();
        number.setLength(0);
        tokens.add(Token.number(parseNumber(lexeme)));
    }

    private void flushFunction(StringBuilder function, List<Token> tokens) {
        if (function.length() == 0) return;
        tokens.add(Token.function(function.toString()));
        function.setLength(0);
    }

    private double parseNumber(String lexeme) {
        if (lexeme.indexOf('.') != lexeme.lastIndexOf('.')) {
            throw new MalformedNumberException(lexeme, null);
        }
        try {
            return Double.parseDouble(lexeme);
        } catch (NumberFormatException e) {
            throw new MalformedNumberException(lexeme, e);
        }
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static boolean isLowercase(char c) {
        return c >= 'a' && c <= 'z';
    }
}
