package com.spreadsheet.formula.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Tokenizer.
 */
class TokenizerTest {

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::getKind).collect(Collectors.toList());
    }

    /**
     * Test that references, operators and positions are reported as written.
     */
    @Test
    void testSimpleExpression() {
        List<Token> tokens = new Tokenizer("A1+B2").tokenize();

        assertEquals(List.of(TokenKind.CELL_REF, TokenKind.OPERATOR, TokenKind.CELL_REF, TokenKind.EOF), kinds(tokens));
        assertEquals("A1", tokens.get(0).getText());
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals("+", tokens.get(1).getText());
        assertEquals(2, tokens.get(1).getPosition());
        assertEquals(3, tokens.get(2).getPosition());
    }

    /**
     * Test that function names and range references are upper-cased.
     */
    @Test
    void testFunctionWithRange() {
        List<Token> tokens = new Tokenizer("sum(a1:b2)").tokenize();

        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.LPAREN, TokenKind.RANGE_REF, TokenKind.RPAREN,
                TokenKind.EOF), kinds(tokens));
        assertEquals("SUM", tokens.get(0).getText());
        assertEquals("A1:B2", tokens.get(2).getText());
        assertEquals("A", tokens.get(2).getReference().getColumnLetters());
        assertEquals("2", tokens.get(2).getRangeEnd().getRowDigits());
    }

    /**
     * Test that a word shaped like a cell reference is a function name when "(" follows.
     */
    @Test
    void testCellShapedFunctionName() {
        List<Token> tokens = new Tokenizer("LOG10(5)").tokenize();

        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).getKind());
        assertEquals("LOG10", tokens.get(0).getText());
    }

    /**
     * Test absolute markers on a reference.
     */
    @Test
    void testAbsoluteReference() {
        Token token = new Tokenizer("$A$1").tokenize().get(0);

        assertEquals(TokenKind.CELL_REF, token.getKind());
        assertTrue(token.getReference().isColumnAbsolute());
        assertTrue(token.getReference().isRowAbsolute());

        Token mixed = new Tokenizer("A$7").tokenize().get(0);
        assertFalse(mixed.getReference().isColumnAbsolute());
        assertTrue(mixed.getReference().isRowAbsolute());
        assertEquals("7", mixed.getReference().getRowDigits());
    }

    /**
     * Test numbers, booleans and strings with escapes.
     */
    @Test
    void testLiterals() {
        List<Token> tokens = new Tokenizer(".5e3 true 'it\\'s' \"Hi\"").tokenize();

        assertEquals(List.of(TokenKind.NUMBER, TokenKind.BOOLEAN, TokenKind.STRING, TokenKind.STRING, TokenKind.EOF),
                kinds(tokens));
        assertEquals(".5e3", tokens.get(0).getText());
        assertEquals("TRUE", tokens.get(1).getText());
        assertEquals("it's", tokens.get(2).getText());
        assertEquals("Hi", tokens.get(3).getText());
    }

    /**
     * Test two-character operators and the "!=" alias.
     */
    @Test
    void testComparisonOperators() {
        List<Token> tokens = new Tokenizer("1<=2<>3>=4!=5").tokenize();

        assertEquals("<=", tokens.get(1).getText());
        assertEquals("<>", tokens.get(3).getText());
        assertEquals(">=", tokens.get(5).getText());
        assertEquals("<>", tokens.get(7).getText());
    }

    /**
     * Test that error literals are recognized.
     */
    @Test
    void testErrorLiteral() {
        List<Token> tokens = new Tokenizer("#REF!+#N/A").tokenize();

        assertEquals(TokenKind.ERROR_LITERAL, tokens.get(0).getKind());
        assertEquals("#REF!", tokens.get(0).getText());
        assertEquals("#N/A", tokens.get(2).getText());
    }

    /**
     * Test that an unexpected character stops tokenizing with an ERROR token.
     */
    @Test
    void testUnexpectedCharacter() {
        List<Token> tokens = new Tokenizer("1 @ 2").tokenize();

        assertEquals(2, tokens.size());
        assertEquals(TokenKind.ERROR, tokens.get(1).getKind());
        assertEquals("@", tokens.get(1).getText());
        assertEquals(2, tokens.get(1).getPosition());
    }

    /**
     * Test that an unterminated string reports the opening quote.
     */
    @Test
    void testUnterminatedString() {
        List<Token> tokens = new Tokenizer("1&\"abc").tokenize();

        Token last = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.ERROR, last.getKind());
        assertEquals(2, last.getPosition());
    }

    /**
     * Test that empty input yields only EOF.
     */
    @Test
    void testEmptyInput() {
        List<Token> tokens = new Tokenizer("   ").tokenize();

        assertEquals(List.of(TokenKind.EOF), kinds(tokens));
    }
}
