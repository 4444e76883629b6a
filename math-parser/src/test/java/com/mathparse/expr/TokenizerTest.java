package com.mathparse.expr;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    public void setup() {
        tokenizer = new Tokenizer();
    }

    @Test
    public void testNumbersAndOperators() {
        List<Token> tokens = tokenizer.scan("13.45+24*2/1^3");
        assertEquals(List.of(
                Token.number(13.45),
                Token.operator(OperatorKind.ADD),
                Token.number(24),
                Token.operator(OperatorKind.MUL),
                Token.number(2),
                Token.operator(OperatorKind.DIV),
                Token.number(1),
                Token.operator(OperatorKind.POW),
                Token.number(3)), tokens);
    }

    @Test
    public void testLeadingMinusStartsNegativeLiteral() {
        assertEquals(List.of(Token.number(-23.4)), tokenizer.scan("-23.4"));
    }

    @Test
    public void testMinusAfterOperandIsSubtraction() {
        assertEquals(List.of(Token.number(432), Token.operator(OperatorKind.SUB), Token.number(2)),
                tokenizer.scan("432-2"));
        assertEquals(List.of(Token.closeParen(), Token.operator(OperatorKind.SUB), Token.number(1)),
                tokenizer.scan(")-1"));
    }

    @Test
    public void testMinusAfterOpenParenOperatorOrComma() {
        assertEquals(List.of(Token.openParen(), Token.number(-3), Token.closeParen()),
                tokenizer.scan("(-3)"));
        assertEquals(List.of(Token.number(10), Token.operator(OperatorKind.SCI_NOTATION), Token.number(-1)),
                tokenizer.scan("10E-1"));
        assertEquals(List.of(Token.function("max"), Token.openParen(), Token.number(1), Token.comma(),
                        Token.number(-2), Token.closeParen()),
                tokenizer.scan("max(1,-2)"));
    }

    @Test
    public void testFunctionNamesAndWhitespace() {
        List<Token> tokens = tokenizer.scan("rad(27, rad(9,2))");
        assertEquals(List.of(
                Token.function("rad"), Token.openParen(), Token.number(27), Token.comma(),
                Token.function("rad"), Token.openParen(), Token.number(9), Token.comma(),
                Token.number(2), Token.closeParen(), Token.closeParen()), tokens);
    }

    @Test
    public void testNumberDirectlyBeforeFunction() {
        assertEquals(List.of(Token.number(2), Token.function("sqrt"), Token.openParen(), Token.number(9),
                Token.closeParen()), tokenizer.scan("2sqrt(9)"));
    }

    @Test
    public void testDigitEndsFunctionName() {
        assertEquals(List.of(Token.function("log"), Token.number(2)), tokenizer.scan("log2"));
    }

    @Test
    public void testUnrecognisedCharactersAreIgnored() {
        assertEquals(List.of(Token.number(2), Token.number(3)), tokenizer.scan("2 $ 3"));
        assertEquals(List.of(Token.number(4)), tokenizer.scan("4X"));
    }

    @Test
    public void testEmptyInput() {
        assertTrue(tokenizer.scan("").isEmpty());
        assertTrue(tokenizer.scan("   ").isEmpty());
        assertTrue(tokenizer.scan(null).isEmpty());
    }

    @Test
    public void testTwoDecimalPointsIsMalformed() {
        MalformedNumberException e = assertThrows(MalformedNumberException.class,
                () -> tokenizer.scan("1.2.3+4"));
        assertEquals("1.2.3", e.getLexeme());
    }

    @Test
    public void testDanglingMinusIsMalformed() {
        MalformedNumberException e = assertThrows(MalformedNumberException.class,
                () -> tokenizer.scan("5*-"));
        assertEquals("-", e.getLexeme());
    }

    @Test
    public void testLoneDecimalPointIsMalformed() {
        assertThrows(MalformedNumberException.class, () -> tokenizer.scan("."));
    }
}
